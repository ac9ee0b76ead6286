package com.jentfoo.imagebatch.progress;

import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.Style;

public class ConsoleStyle {
  private final Ansi ansi;

  public ConsoleStyle(Ansi ansi) {
    this.ansi = ansi;
  }

  public boolean isEnabled() {
    return ansi.enabled();
  }

  public String bold(String text) {
    return apply(text, Style.bold);
  }

  public String dim(String text) {
    return apply(text, Style.faint);
  }

  public String cyan(String text) {
    return apply(text, Style.fg_cyan);
  }

  public String green(String text) {
    return apply(text, Style.fg_green);
  }

  public String red(String text) {
    return apply(text, Style.fg_red);
  }

  public String yellow(String text) {
    return apply(text, Style.fg_yellow);
  }

  private String apply(String text, Style style) {
    if (text == null || text.isEmpty() || ! ansi.enabled()) {
      return text == null ? "" : text;
    }

    return Style.on(style) + text + Style.off(style);
  }
}
