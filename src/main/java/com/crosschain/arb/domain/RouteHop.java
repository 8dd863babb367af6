package com.crosschain.arb.domain;

import lombok.Value;

@Value
public class RouteHop {
    int protocolId; // 1 = Uniswap V3, 2 = Curve
    String router;
}
