package com.work.txpipeline.web;

import com.work.txpipeline.vault.repository.entity.WalletEntity;
import com.work.txpipeline.vault.service.WalletKeyService;
import com.work.txpipeline.web.dto.CreateWalletRequest;
import com.work.txpipeline.web.dto.WalletView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.util.Arrays;

@RestController
@RequestMapping("/api/v1/wallets")
public class WalletController {

    private final WalletKeyService wallets;

    public WalletController(WalletKeyService wallets) {
        this.wallets = wallets;
    }

    @PostMapping
    public ResponseEntity<WalletView> create(@Validated @RequestBody CreateWalletRequest req) {
        WalletEntity wallet;
        if (req.getPrivateKey() == null) {
            wallet = wallets.createWallet(req.getUserId());
        } else {
            byte[] key = Numeric.hexStringToByteArray(req.getPrivateKey());
            try {
                wallet = wallets.importWallet(req.getUserId(), key);
            } finally {
                Arrays.fill(key, (byte) 0);
            }
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(wallet));
    }

    @GetMapping("/{address}")
    public ResponseEntity<WalletView> get(@PathVariable("address") String address) {
        WalletEntity wallet = wallets.findWallet(address);
        if (wallet == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toView(wallet));
    }

    private WalletView toView(WalletEntity e) {
        WalletView v = new WalletView();
        v.setUserId(e.getUserId());
        v.setAddress(e.getAddress());
        v.setCreatedAt(e.getCreatedAt());
        return v;
    }
}
