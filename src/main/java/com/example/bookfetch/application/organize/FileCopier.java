package com.example.bookfetch.application.organize;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes one file into the library. The target must not exist yet.
 */
public interface FileCopier {

    void copy(Path source, Path target) throws IOException;
}
