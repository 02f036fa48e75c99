package de.example.monthy;

/**
 * Removes a trailing {@code #} or {@code //} comment from one line.
 *
 * <p>A marker only starts a comment when the text before it holds an even number of single and of
 * double quotes. Only the first occurrence of each marker is looked at. Escaped quotes and strings
 * spanning several lines are not recognised.
 */
public final class CommentStripper {

  private static final String[] MARKERS = {"#", "//"};

  private CommentStripper() {
  }

  public static String strip(String line) {
    if (line == null) return "";
    for (String marker : MARKERS) {
      int at = line.indexOf(marker);
      if (at < 0) continue;
      String head = line.substring(0, at);
      if (count(head, '"') % 2 == 0 && count(head, '\'') % 2 == 0) {
        return head.stripTrailing();
      }
    }
    return line;
  }

  private static int count(String s, char c) {
    int n = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) n++;
    }
    return n;
  }
}
