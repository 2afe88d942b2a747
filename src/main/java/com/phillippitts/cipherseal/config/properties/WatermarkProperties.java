package com.phillippitts.cipherseal.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Watermark service settings.
 *
 * <p>Example application.properties:
 * <pre>
 * watermark.secret-key=${WATERMARKER_SECRET_KEY:}
 * watermark.default-max-length=200
 * watermark.upload.max-file-size-bytes=26214400
 * </pre>
 *
 * <p>Note: Bean created via {@link com.phillippitts.cipherseal.CipherSealApplication#EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "watermark")
@Validated
public class WatermarkProperties {

    /** Environment variable that carries the master secret key. */
    public static final String SECRET_KEY_ENV_VAR = "WATERMARKER_SECRET_KEY";

    /** Master secret key. Blank means the service is not configured and refuses to run. */
    private String secretKey = "";

    /** Expected maximum watermark length in characters when a detect request gives none. */
    @Positive(message = "Default max length must be positive")
    private int defaultMaxLength = 200;

    @Valid
    private Upload upload = new Upload();

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean isSecretKeyConfigured() {
        return secretKey != null && !secretKey.isEmpty();
    }

    public int getDefaultMaxLength() {
        return defaultMaxLength;
    }

    public void setDefaultMaxLength(int defaultMaxLength) {
        this.defaultMaxLength = defaultMaxLength;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    /**
     * Upload limits (security guard against memory and disk exhaustion).
     */
    public static class Upload {

        /** Maximum image upload size in bytes. Default: 25 MB. */
        @Positive(message = "Maximum image upload size must be positive")
        private long maxFileSizeBytes = 25L * 1024 * 1024;

        /** Maximum text upload size in bytes. Default: 5 MB. */
        @Positive(message = "Maximum text upload size must be positive")
        private long maxTextFileSizeBytes = 5L * 1024 * 1024;

        public long getMaxFileSizeBytes() {
            return maxFileSizeBytes;
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public long getMaxTextFileSizeBytes() {
            return maxTextFileSizeBytes;
        }

        public void setMaxTextFileSizeBytes(long maxTextFileSizeBytes) {
            this.maxTextFileSizeBytes = maxTextFileSizeBytes;
        }
    }
}
