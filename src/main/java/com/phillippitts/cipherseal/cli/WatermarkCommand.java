package com.phillippitts.cipherseal.cli;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.CipherSealException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Shared plumbing for subcommands: key lookup, console output and mapping of domain
 * exceptions to exit code 1.
 */
abstract class WatermarkCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final Function<String, String> environment;

    @Spec
    CommandSpec spec;

    WatermarkCommand(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public final Integer call() {
        String secret = environment.apply(WatermarkProperties.SECRET_KEY_ENV_VAR);
        if (secret == null || secret.isEmpty()) {
            error("The " + WatermarkProperties.SECRET_KEY_ENV_VAR + " environment variable is not set.");
            return EXIT_FAILURE;
        }
        try {
            return run(WatermarkKey.of(secret));
        } catch (CipherSealException e) {
            error(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Runs the command with the master key.
     *
     * @return process exit code
     */
    abstract int run(WatermarkKey key);

    void info(String message) {
        PrintWriter out = spec.commandLine().getOut();
        out.println("CLI Info: " + message);
        out.flush();
    }

    void success(String message) {
        PrintWriter out = spec.commandLine().getOut();
        out.println("CLI Success: " + message);
        out.flush();
    }

    void warning(String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("CLI Warning: " + message);
        err.flush();
    }

    void error(String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println("CLI Error: " + message);
        err.flush();
    }
}
