package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InputResolver {
  private static final Logger log = LoggerFactory.getLogger(InputResolver.class);

  public static List<File> resolve(List<String> paths) {
    List<File> validFiles = new ArrayList<File>(paths.size());
    for (String inputPath : paths) {
      Path path = Paths.get(inputPath);
      BasicFileAttributes attributes;
      try {
        attributes = Files.readAttributes(path, BasicFileAttributes.class);
      } catch (NoSuchFileException e) {
        log.warn("Input file does not exist: {}", path.toAbsolutePath());
        continue;
      } catch (IOException e) {
        throw new IllegalStateException("Could not read input: " + path.toAbsolutePath(), e);
      }

      if (attributes.isDirectory()) {
        validFiles.addAll(listRegularFiles(path));
      } else {
        validFiles.add(new File(inputPath));
      }
    }

    return validFiles;
  }

  private static List<File> listRegularFiles(Path directory) {
    List<File> result = new ArrayList<File>();
    try {
      DirectoryStream<Path> stream = Files.newDirectoryStream(directory);
      try {
        for (Path entry : stream) {
          // symlinks, sub-directories and special files are ignored
          if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
            result.add(entry.toFile());
          }
        }
      } finally {
        stream.close();
      }
    } catch (IOException e) {
      throw new IllegalStateException("Could not list input directory: " + directory.toAbsolutePath(), e);
    }
    Collections.sort(result);

    return result;
  }
}
