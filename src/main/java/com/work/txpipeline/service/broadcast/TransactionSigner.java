package com.work.txpipeline.service.broadcast;

import com.work.txpipeline.vault.service.WalletKeyService;
import org.springframework.stereotype.Component;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;

/**
 * 用 vault 中的钱包私钥签名。签名是确定性的（RFC 6979），同一交易总是得到同一 hash。
 */
@Component
public class TransactionSigner {

    private final WalletKeyService wallets;

    public TransactionSigner(WalletKeyService wallets) {
        this.wallets = wallets;
    }

    public byte[] sign(String address, RawTransaction tx) {
        return wallets.withCredentials(address, credentials -> TransactionEncoder.signMessage(tx, credentials));
    }
}
