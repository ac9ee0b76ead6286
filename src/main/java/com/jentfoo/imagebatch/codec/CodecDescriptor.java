package com.jentfoo.imagebatch.codec;

public class CodecDescriptor {
  public enum Kind { Preprocessor, Encoder };

  private final Kind kind;
  private final String name;
  private final String displayName;
  private final String description;
  private final String extension;

  public static CodecDescriptor preprocessor(String name, String description) {
    return new CodecDescriptor(Kind.Preprocessor, name, name, description, null);
  }

  public static CodecDescriptor encoder(String name, String displayName, String extension) {
    return new CodecDescriptor(Kind.Encoder, name, displayName,
                               "Use " + displayName + " to generate a ." + extension +
                                 " file with the given configuration",
                               extension);
  }

  private CodecDescriptor(Kind kind, String name, String displayName,
                          String description, String extension) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Codec must have a name");
    } else if (kind == Kind.Encoder && (extension == null || extension.isEmpty())) {
      throw new IllegalArgumentException("Encoder must produce an extension: " + name);
    }

    this.kind = kind;
    this.name = name;
    this.displayName = displayName;
    this.description = description;
    this.extension = extension;
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getDescription() {
    return description;
  }

  public String getExtension() {
    return extension;
  }

  public String getExtensionAlias() {
    if (extension != null && ! extension.equals(name)) {
      return extension;
    } else {
      return null;
    }
  }

  @Override
  public String toString() {
    return kind + ":" + name;
  }
}
