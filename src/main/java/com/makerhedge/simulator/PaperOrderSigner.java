package com.makerhedge.simulator;

import com.makerhedge.domain.model.InstrumentSpec;
import com.makerhedge.exception.SigningException;
import com.makerhedge.exchange.AccountCredentials;
import com.makerhedge.exchange.OrderSigner;
import com.makerhedge.exchange.SignedOrder;
import com.makerhedge.exchange.UnsignedOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Signs paper orders with HMAC-SHA256 over a canonical text form of the order, keyed by the
 * account's private key. Gives the simulator a deterministic signature to check; it is not
 * the venue's typed-data signature scheme.
 */
public class PaperOrderSigner implements OrderSigner {

    private static final String ALGORITHM = "HmacSHA256";

    @Override
    public SignedOrder sign(UnsignedOrder order, InstrumentSpec instrument, AccountCredentials credentials) {
        if (credentials.getPrivateKey() == null || credentials.getPrivateKey().isEmpty()) {
            throw new SigningException("No private key for account " + credentials.getName(), null);
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(credentials.getPrivateKey().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(canonical(order).getBytes(StandardCharsets.UTF_8));
            return new SignedOrder(order, "paper:" + credentials.getAccountId(), "0x" + HexFormat.of().formatHex(digest));
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to sign order " + order.getClientOrderId(), e);
        }
    }

    static String canonical(UnsignedOrder order) {
        return String.join(
                "|",
                order.getSubAccountId(),
                order.getInstrument(),
                order.getSide().name(),
                order.getLimitPrice().toPlainString(),
                order.getSize().toPlainString(),
                String.valueOf(order.isPostOnly()),
                order.getTimeInForce(),
                String.valueOf(order.getExpiration().toEpochMilli()),
                String.valueOf(order.getNonce()),
                order.getClientOrderId());
    }
}
