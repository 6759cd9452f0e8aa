package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.WebhookProperties;
import com.example.scenegen_backend.util.Hmacs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.util.HexFormat;

@Component
public class WebhookSignatureVerifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    static final String PREFIX = "sha256=";

    private final WebhookProperties props;

    public WebhookSignatureVerifier(WebhookProperties props) {
        this.props = props;
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        String secret = props.getSecret();
        if (secret == null || secret.isBlank()) {
            LOGGER.error("Webhook rejected: webhook.secret is not configured");
            return false;
        }
        if (signatureHeader == null || !signatureHeader.trim().startsWith(PREFIX)) {
            return false;
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.trim().substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] expected = Hmacs.sha256(secret, rawBody == null ? new byte[0] : rawBody);
        return MessageDigest.isEqual(expected, provided);
    }

    public String sign(byte[] rawBody) {
        return PREFIX + HexFormat.of().formatHex(Hmacs.sha256(props.getSecret(), rawBody));
    }
}
