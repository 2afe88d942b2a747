package com.phillippitts.cipherseal.cli;

import com.phillippitts.cipherseal.service.codec.KeyedLocationGenerator;
import com.phillippitts.cipherseal.service.codec.LsbBitCodec;
import com.phillippitts.cipherseal.service.image.ImageWatermarkService;
import com.phillippitts.cipherseal.service.metrics.WatermarkMetrics;
import com.phillippitts.cipherseal.service.text.TextWatermarkService;
import com.phillippitts.cipherseal.service.text.ZeroWidthTextWatermarker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.function.Function;

/**
 * Command-line entry point. Runs without the Spring context; the master key comes from the
 * {@code WATERMARKER_SECRET_KEY} environment variable.
 *
 * <pre>
 * cipherseal add image photo.png -o marked.png -w "owner-42"
 * cipherseal detect image marked.png --max-len 50
 * </pre>
 */
@Command(
        name = "cipherseal",
        mixinStandardHelpOptions = true,
        version = "CipherSeal CLI 0.1.0",
        description = "Keyed invisible watermarking for images and text.%n"
                + "Reads the master secret key from the WATERMARKER_SECRET_KEY environment variable."
)
public class CipherSealCli {

    public static void main(String[] args) {
        int exitCode = newCommandLine(System::getenv).execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the command tree with services wired by hand.
     *
     * @param environment environment variable lookup
     */
    public static CommandLine newCommandLine(Function<String, String> environment) {
        WatermarkMetrics metrics = new WatermarkMetrics(new SimpleMeterRegistry());
        ImageWatermarkService images =
                new ImageWatermarkService(new LsbBitCodec(new KeyedLocationGenerator()), metrics);
        TextWatermarkService texts = new TextWatermarkService(new ZeroWidthTextWatermarker(), metrics);

        CommandLine cmd = new CommandLine(new CipherSealCli());
        cmd.addSubcommand("add", new AddCommand(images, texts, environment));
        cmd.addSubcommand("detect", new DetectCommand(images, texts, environment));
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }
}
