package com.jentfoo.imagebatch;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public class FileUtils {
  private static final int BUFFER_SIZE = 8192;

  public static File makeOutputFile(File destFolder, File sourceFile,
                                    String suffix, String extension) {
    if (! extension.startsWith(".")) {
      extension = "." + extension;
    }

    String newName = stripExtension(sourceFile.getName()) + suffix + extension;

    return new File(destFolder, newName);
  }

  public static String stripExtension(String name) {
    String extension = getExtension(name);

    return name.substring(0, name.length() - extension.length());
  }

  // a leading dot (ie .bashrc) is part of the name, not an extension
  public static String getExtension(String name) {
    int index = name.lastIndexOf('.');
    if (index > 0) {
      return name.substring(index);
    } else {
      return "";
    }
  }

  public static void ensureDirectory(File destFolder) {
    if (! destFolder.exists()) {
      // another process may have created it between the checks
      if (! destFolder.mkdirs() && ! destFolder.isDirectory()) {
        throw new IllegalStateException("Could not make destination folder: " +
                                          destFolder.getAbsolutePath());
      }
    } else if (! destFolder.isDirectory()) {
      throw new IllegalStateException("Destination folder is not a folder: " +
                                        destFolder.getAbsolutePath());
    }
  }

  public static byte[] readFile(File sourceFile) throws IOException {
    InputStream in = new FileInputStream(sourceFile);
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream((int)Math.min(Integer.MAX_VALUE - 8,
                                                                          Math.max(BUFFER_SIZE,
                                                                                   sourceFile.length())));
      byte[] buf = new byte[BUFFER_SIZE];
      int len;
      while ((len = in.read(buf)) > -1) {
        out.write(buf, 0, len);
      }

      return out.toByteArray();
    } finally {
      in.close();
    }
  }

  public static void writeFile(File destFile, byte[] data) throws IOException {
    OutputStream out = new FileOutputStream(destFile);
    try {
      out.write(data);
    } finally {
      out.close();
    }
  }
}
