package com.phillippitts.cipherseal.config;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.service.image.ImageFormats;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.util.Arrays;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Reports at startup whether the service can do its job.
 *
 * <p>A missing key does not abort startup: the API comes up degraded and every watermark
 * endpoint answers 503 until the key is supplied.
 */
@Component
class WatermarkConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(WatermarkConfigurationValidator.class);

    private final WatermarkProperties properties;

    WatermarkConfigurationValidator(WatermarkProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Image codecs: readable={}, writable={}",
                formats(ImageIO.getReaderFormatNames()), formats(ImageIO.getWriterFormatNames()));

        if (!ImageFormats.canWrite(ImageFormats.DEFAULT_FORMAT)) {
            LOG.fatal("No ImageIO writer for '{}'. Image watermarking will not function.",
                    ImageFormats.DEFAULT_FORMAT);
        }

        if (properties.isSecretKeyConfigured()) {
            LOG.info("Master secret key configured; watermark endpoints enabled (defaultMaxLength={})",
                    properties.getDefaultMaxLength());
        } else {
            LOG.error("Master secret key not configured. Set the {} environment variable; "
                    + "watermark endpoints will answer 503 until then.", WatermarkProperties.SECRET_KEY_ENV_VAR);
        }
    }

    private static TreeSet<String> formats(String[] names) {
        TreeSet<String> out = new TreeSet<>();
        Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT)).forEach(out::add);
        return out;
    }
}
