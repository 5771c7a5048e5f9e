package com.payoutengine.api.dto;

import com.payoutengine.payout.Payout;
import com.payoutengine.payout.PayoutLine;
import lombok.Value;

import java.util.List;

@Value
public class PayoutDetails {
    Payout payout;
    List<PayoutLine> lines;
}
