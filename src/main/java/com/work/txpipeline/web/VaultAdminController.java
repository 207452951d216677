package com.work.txpipeline.web;

import com.work.txpipeline.vault.service.DataKeyRotationService;
import com.work.txpipeline.vault.service.DataKeyRotationService.RotationReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 主密钥轮换后调用：把全部 DEK 重新包裹到当前主密钥下。
 */
@RestController
@RequestMapping("/api/v1/admin/vault")
public class VaultAdminController {

    private final DataKeyRotationService rotation;

    public VaultAdminController(DataKeyRotationService rotation) {
        this.rotation = rotation;
    }

    @PostMapping("/rotate")
    public RotationReport rotate() {
        return rotation.rotateDataKeys();
    }
}
