package com.phillippitts.cipherseal.exception;

/**
 * Thrown when a watermark operation is requested but the master secret key has not been configured.
 * Embedding and detection refuse to run without it.
 */
public class ServiceNotConfiguredException extends CipherSealException {

    private final String setting;

    public ServiceNotConfiguredException(String setting) {
        super("Watermark service not configured: missing " + setting);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
