package work.rospkg.setup;

import java.nio.file.Path;

/**
 * Raised when the setup options of a Python package cannot be determined.
 */
public final class SetupOptionsException extends RuntimeException {
    private final Path setupScript;
    private final int exitCode;
    private final String output;

    public SetupOptionsException(String message, Path setupScript, int exitCode, String output) {
        super(message);
        this.setupScript = setupScript;
        this.exitCode = exitCode;
        this.output = output;
    }

    public SetupOptionsException(String message, Path setupScript, Throwable cause) {
        super(message, cause);
        this.setupScript = setupScript;
        this.exitCode = -1;
        this.output = "";
    }

    public Path setupScript() {
        return setupScript;
    }

    /**
     * Exit code of the interpreter, {@code -1} when it did not exit normally.
     */
    public int exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
