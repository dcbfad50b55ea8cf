package io.jobwarden.monitor;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Counts {@code *.eml} files in the unprocessable-mail directory. A missing directory counts as empty.
 */
public class FileSystemMailSpool implements MailSpool {

    private final Path directory;

    public FileSystemMailSpool(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public long countUnprocessable() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        long count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.eml")) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    count++;
                }
            }
        } catch (IOException e) {
            throw new TransientCollaboratorException("cannot read mail spool " + directory, e);
        }
        return count;
    }

    public Path directory() {
        return directory;
    }
}
