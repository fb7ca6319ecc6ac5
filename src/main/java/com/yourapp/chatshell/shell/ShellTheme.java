package com.yourapp.chatshell.shell;

/** ANSI sequences used by the console; every field is empty when colors are disabled. */
public record ShellTheme(
    String reset,
    String bold,
    String dim,
    String user,
    String assistant,
    String info,
    String success,
    String warning,
    String error,
    String header
) {

  public static ShellTheme of(boolean colorsEnabled) {
    if (!colorsEnabled) {
      return new ShellTheme("", "", "", "", "", "", "", "", "", "");
    }
    return new ShellTheme(
        "\u001B[0m",
        "\u001B[1m",
        "\u001B[2m",
        "\u001B[94m",
        "\u001B[92m",
        "\u001B[36m",
        "\u001B[92m",
        "\u001B[93m",
        "\u001B[91m",
        "\u001B[96m");
  }

  public boolean colorsEnabled() {
    return !reset.isEmpty();
  }
}
