package com.makerhedge.exchange;

import com.makerhedge.domain.model.InstrumentSpec;

/** Produces the signature the exchange requires on every order. */
@FunctionalInterface
public interface OrderSigner {

    /**
     * Signs an order on behalf of the account.
     *
     * @throws com.makerhedge.exception.SigningException when the payload cannot be signed
     */
    SignedOrder sign(UnsignedOrder order, InstrumentSpec instrument, AccountCredentials credentials);
}
