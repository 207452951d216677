package com.work.txpipeline.service.broadcast;

import com.work.txpipeline.core.exception.BroadcastRejectedException.Kind;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 按节点错误文本归类（geth / erigon / nethermind / besu 的常见措辞）。
 */
@Component
public class BroadcastErrorClassifier {

    private static final List<String> ALREADY_KNOWN = Arrays.asList(
            "already known", "known transaction", "alreadyknown", "already imported", "transaction already exists");

    private static final List<String> NONCE_TOO_LOW = Arrays.asList(
            "nonce too low", "nonce is too low", "oldnonce", "nonce has already been used");

    private static final List<String> UNDERPRICED = Arrays.asList(
            "underpriced", "replacement fee too low", "fee too low");

    public Kind classify(String message) {
        if (message == null) {
            return Kind.OTHER;
        }
        String m = message.toLowerCase(Locale.ROOT);
        if (containsAny(m, ALREADY_KNOWN)) {
            return Kind.ALREADY_KNOWN;
        }
        if (containsAny(m, NONCE_TOO_LOW)) {
            return Kind.NONCE_TOO_LOW;
        }
        if (containsAny(m, UNDERPRICED)) {
            return Kind.UNDERPRICED;
        }
        return Kind.OTHER;
    }

    private static boolean containsAny(String m, List<String> patterns) {
        for (String p : patterns) {
            if (m.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
