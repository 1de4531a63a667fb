package com.makerhedge.exchange;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** API credentials of one trading sub-account. Keys never appear in toString output. */
@Value
@Builder
public class AccountCredentials {

    String name;

    @ToString.Exclude
    String apiKey;

    String accountId;

    @ToString.Exclude
    String privateKey;

    String env;
}
