package com.work.txpipeline.web;

import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.IntentRequest;
import com.work.txpipeline.domain.IntentStatusView;
import com.work.txpipeline.service.TxPipelineService;
import com.work.txpipeline.web.dto.CreateIntentRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Intent 对外契约：注册幂等（重复 intentKey 返回 200 与已有 Intent），状态只能轮询。
 */
@RestController
@RequestMapping("/api/v1/intents")
public class IntentController {

    private final TxPipelineService pipeline;

    public IntentController(TxPipelineService pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping
    public ResponseEntity<IntentStatusView> register(@Validated @RequestBody CreateIntentRequest req) {
        BigInteger value = req.getValue() == null ? BigInteger.ZERO : new BigInteger(req.getValue());
        BuiltCall call = new BuiltCall(req.getTo(), value, req.getData(), req.getGasLimit());
        IntentStatusView view = pipeline.registerIntent(
                new IntentRequest(req.getIntentKey(), req.getSigningAddress(), call, req.getMetadata()));
        HttpStatus status = view.isDuplicate() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(view);
    }

    @GetMapping("/{id}")
    public IntentStatusView get(@PathVariable("id") long id) {
        return pipeline.getIntentStatus(id);
    }

    @GetMapping("/by-key")
    public IntentStatusView getByKey(@RequestParam("intentKey") String intentKey) {
        return pipeline.getIntentStatusByKey(intentKey);
    }

    @PostMapping("/{id}/replace")
    public IntentStatusView forceReplace(@PathVariable("id") long id) {
        return pipeline.forceReplace(id);
    }

    @PostMapping("/{id}/cancel")
    public IntentStatusView cancel(@PathVariable("id") long id) {
        return pipeline.cancel(id);
    }
}
