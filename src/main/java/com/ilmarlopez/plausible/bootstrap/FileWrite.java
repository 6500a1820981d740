package com.ilmarlopez.plausible.bootstrap;

import java.util.List;

/**
 * Writes a root-owned file with sudo tee, replacing any previous content.
 * Single line content is piped from echo, anything longer goes through a quoted heredoc
 * so the shell does not expand variables such as nginx's $host.
 */
public class FileWrite implements BootStep {

    private static final String HEREDOC_MARKER = "EOF";

    private final BootPhase phase;
    private final String path;
    private final String content;

    private FileWrite(BootPhase phase, String path, String content) {
        this.phase = phase;
        this.path = path;
        this.content = content;
    }

    public static FileWrite of(BootPhase phase, String path, String content) {
        return new FileWrite(phase, path, content);
    }

    @Override
    public BootPhase getPhase() {
        return phase;
    }

    @Override
    public List<String> render() {
        if (!content.contains("\n")) {
            return List.of("echo '" + content + "' | sudo tee " + path);
        }
        String body = content.endsWith("\n") ? content : content + "\n";
        return List.of("sudo tee " + path + " > /dev/null << '" + HEREDOC_MARKER + "'\n" +
                body + HEREDOC_MARKER + "\n");
    }

    @Override
    public String toString() {
        return "FileWrite{phase=" + phase + ", path='" + path + "'}";
    }
}
