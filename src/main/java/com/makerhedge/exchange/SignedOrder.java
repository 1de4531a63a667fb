package com.makerhedge.exchange;

import lombok.Value;

@Value
public class SignedOrder {

    UnsignedOrder order;
    String signer;
    String signature;
}
