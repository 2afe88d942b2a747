package com.phillippitts.cipherseal.cli;

import com.phillippitts.cipherseal.domain.CapacityReport;
import com.phillippitts.cipherseal.domain.EmbedResult;
import com.phillippitts.cipherseal.domain.MediaType;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.service.WatermarkIdGenerator;
import com.phillippitts.cipherseal.service.image.ImageWatermarkService;
import com.phillippitts.cipherseal.service.text.TextWatermarkService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.function.Function;

@Command(name = "add", description = "Embed a watermark into an image or text file.")
class AddCommand extends WatermarkCommand {

    private final ImageWatermarkService images;
    private final TextWatermarkService texts;

    @Parameters(index = "0", paramLabel = "<media>", description = "Media type: image or text.")
    private MediaType mediaType;

    @Parameters(index = "1", paramLabel = "<input>", description = "Path to the input file.")
    private Path input;

    @Option(names = {"-o", "--output"}, required = true, description = "Path to save the watermarked file.")
    private Path output;

    @Option(names = {"-w", "--watermark"},
            description = "Watermark text to embed. A UUID is generated when omitted.")
    private String watermark;

    AddCommand(ImageWatermarkService images, TextWatermarkService texts, Function<String, String> environment) {
        super(environment);
        this.images = images;
        this.texts = texts;
    }

    @Override
    int run(WatermarkKey key) {
        String text = watermark;
        if (text == null || text.isBlank()) {
            text = WatermarkIdGenerator.generate();
            info("No explicit watermark text provided, generated unique watermark: " + text);
        }
        info("Attempting to 'add' watermark to " + mediaType.tag() + " '" + input + "'...");

        EmbedResult result = mediaType == MediaType.IMAGE
                ? images.addWatermark(input, output, text, key)
                : texts.addWatermark(input, output, text, key);

        switch (result.status()) {
            case EMBEDDED:
                result.warnings().forEach(this::warning);
                success("Watermark added successfully to '" + output + "'.");
                return EXIT_OK;
            case INSUFFICIENT_CAPACITY:
                CapacityReport capacity = result.capacity();
                error("Watermark too large for '" + input + "': required " + capacity.requiredBits()
                        + " bits, available " + capacity.capacityBits() + " bits.");
                return EXIT_FAILURE;
            default:
                error("Input file not found: '" + input + "'.");
                return EXIT_FAILURE;
        }
    }
}
