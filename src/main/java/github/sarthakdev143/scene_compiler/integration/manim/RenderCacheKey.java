package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.model.QualityTier;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hash identifying one rendered clip: same script, scene class and quality give the same key.
 */
public final class RenderCacheKey {

    private RenderCacheKey() {
    }

    public static String of(String script, String sceneName, QualityTier quality) {
        String content = String.join("\n", script == null ? "" : script, sceneName == null ? "" : sceneName,
                quality.renderFlag());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hashed.length * 2);
            for (byte value : hashed) {
                hex.append(String.format("%02x", value));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
