package com.example.bookfetch.application.organize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class NioFileCopier implements FileCopier {

    @Override
    public void copy(Path source, Path target) throws IOException {
        Files.copy(source, target);
    }
}
