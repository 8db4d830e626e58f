package io.jobrelay.core.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import com.google.common.base.Optional;

public final class WatchedFiles
{
    private WatchedFiles()
    { }

    /**
     * Returns the modification time of the path, or absent if it does not exist.
     */
    public static Optional<Instant> readModifiedTime(String path)
        throws IOException
    {
        return readModifiedTime(Paths.get(path));
    }

    public static Optional<Instant> readModifiedTime(Path path)
        throws IOException
    {
        try {
            return Optional.of(Files.getLastModifiedTime(path).toInstant());
        }
        catch (NoSuchFileException ex) {
            return Optional.absent();
        }
    }
}
