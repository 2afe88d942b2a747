package com.phillippitts.cipherseal.cli;

import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.domain.DetectionStatus;
import com.phillippitts.cipherseal.domain.MediaType;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.service.image.ImageWatermarkService;
import com.phillippitts.cipherseal.service.text.TextWatermarkService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.function.Function;

@Command(name = "detect", description = "Detect a watermark in an image or text file.")
class DetectCommand extends WatermarkCommand {

    private final ImageWatermarkService images;
    private final TextWatermarkService texts;

    @Parameters(index = "0", paramLabel = "<media>", description = "Media type: image or text.")
    private MediaType mediaType;

    @Parameters(index = "1", paramLabel = "<input>", description = "Path to the file to inspect.")
    private Path input;

    @Option(names = {"--max-len", "--max_len"}, defaultValue = "200",
            description = "Expected maximum watermark length in characters for images (default: ${DEFAULT-VALUE}).")
    private int maxLen;

    DetectCommand(ImageWatermarkService images, TextWatermarkService texts, Function<String, String> environment) {
        super(environment);
        this.images = images;
        this.texts = texts;
    }

    @Override
    int run(WatermarkKey key) {
        if (maxLen <= 0) {
            throw new ParameterException(spec.commandLine(), "--max-len must be positive, got: " + maxLen);
        }
        info("Attempting to 'detect' watermark in " + mediaType.tag() + " '" + input + "'...");

        DetectionResult result = mediaType == MediaType.IMAGE
                ? images.detectWatermark(input, key, maxLen)
                : texts.detectWatermark(input, key);

        if (result.isDetected()) {
            success("Detected watermark: '" + result.watermark() + "'");
            return EXIT_OK;
        }
        if (result.status() == DetectionStatus.SOURCE_NOT_FOUND) {
            error("Input file not found: '" + input + "'.");
        } else {
            info("No watermark detected.");
        }
        return EXIT_FAILURE;
    }
}
