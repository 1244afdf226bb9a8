package com.tanmi.core.workspace;

import com.tanmi.core.error.ErrorCode;
import com.tanmi.core.error.TanmiException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Validation of user-supplied names, titles and project paths.
 */
public final class Names {

    private static final Pattern INVALID_CHARS = Pattern.compile("[/\\\\:*?\"<>|]");
    private static final String INVALID_CHARS_DISPLAY = "/ \\ : * ? \" < > |";

    private Names() {}

    public static void validateWorkspaceName(String name) {
        if (name == null || name.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_NAME, "Workspace name must not be blank");
        }
        if (INVALID_CHARS.matcher(name).find()) {
            throw new TanmiException(ErrorCode.INVALID_NAME,
                    "Workspace name must not contain any of: " + INVALID_CHARS_DISPLAY);
        }
    }

    public static void validateNodeTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_TITLE, "Node title must not be blank");
        }
        if (INVALID_CHARS.matcher(title).find()) {
            throw new TanmiException(ErrorCode.INVALID_TITLE,
                    "Node title must not contain any of: " + INVALID_CHARS_DISPLAY);
        }
    }

    /**
     * Resolves a project root to an absolute, normalized directory path.
     *
     * @throws TanmiException {@code INVALID_PATH} for blank input, {@code ..} segments or a missing directory
     */
    public static Path validateProjectRoot(String input) {
        if (input == null || input.isBlank()) {
            throw new TanmiException(ErrorCode.INVALID_PATH, "Project root must not be blank");
        }
        var normalizedInput = input.replace('\\', '/');
        for (String segment : normalizedInput.split("/")) {
            if (segment.equals("..")) {
                throw new TanmiException(ErrorCode.INVALID_PATH, "Project root must not contain '..': " + input);
            }
        }
        Path resolved = Path.of(input).toAbsolutePath().normalize();
        if (!Files.isDirectory(resolved)) {
            throw new TanmiException(ErrorCode.INVALID_PATH, "Project root is not a directory: " + resolved);
        }
        return resolved;
    }
}
