package io.github.randomcodespace.dockerbuild.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Purely lexical view of a path string: an optional drive prefix, a rooted flag and the remaining
 * segments with {@code .} and {@code ..} already collapsed. Never touches the filesystem.
 */
final class LexicalPath {
  static final String WINDOWS_LONGPATH_PREFIX = "\\\\?\\";
  static final String WINDOWS_UNC_LONGPATH_MARKER = "UNC\\";

  private static final String PARENT = "..";
  private static final String CURRENT = ".";

  private final String drive;
  private final boolean absolute;
  private final List<String> segments;
  private final boolean windows;

  private LexicalPath(String drive, boolean absolute, List<String> segments, boolean windows) {
    this.drive = drive;
    this.absolute = absolute;
    this.segments = Collections.unmodifiableList(segments);
    this.windows = windows;
  }

  /**
   * Parses a raw path string. Backslashes are always treated as separators. In windows mode a
   * leading long-path prefix is dropped and a leading drive letter ({@code C:}) or UNC share
   * ({@code //server/share}) is split off as the drive. A UNC path is always rooted at its share.
   */
  static LexicalPath parse(String raw, boolean windows) {
    String text = raw;
    if (windows && text.startsWith(WINDOWS_LONGPATH_PREFIX)) {
      text = text.substring(WINDOWS_LONGPATH_PREFIX.length());
      if (text.regionMatches(true, 0, WINDOWS_UNC_LONGPATH_MARKER, 0, 4)) {
        // \\?\UNC\server\share is the long form of \\server\share
        text = "\\\\" + text.substring(WINDOWS_UNC_LONGPATH_MARKER.length());
      }
    }
    text = text.replace('\\', '/');

    String drive = "";
    if (windows && text.startsWith("//")) {
      String[] share = text.substring(2).split("/", 3);
      drive = "//" + share[0] + (share.length > 1 ? "/" + share[1] : "");
      String[] rest = share.length > 2 ? share[2].split("/") : new String[0];
      List<String> segments = collapse(new ArrayList<>(), rest, true);
      return new LexicalPath(drive, true, segments, windows);
    }
    if (windows
        && text.length() >= 2
        && text.charAt(1) == ':'
        && Character.isLetter(text.charAt(0))) {
      drive = text.substring(0, 2);
      text = text.substring(2);
    }

    boolean absolute = text.startsWith("/");
    List<String> segments = collapse(new ArrayList<>(), text.split("/"), absolute);
    return new LexicalPath(drive, absolute, segments, windows);
  }

  private static List<String> collapse(List<String> into, String[] parts, boolean absolute) {
    for (String part : parts) {
      if (part.isEmpty() || CURRENT.equals(part)) {
        continue;
      }
      if (PARENT.equals(part)) {
        if (!into.isEmpty() && !PARENT.equals(into.get(into.size() - 1))) {
          into.remove(into.size() - 1);
        } else if (!absolute) {
          into.add(PARENT);
        }
        // ".." at the root of an absolute path stays at the root
      } else {
        into.add(part);
      }
    }
    return into;
  }

  boolean isAbsolute() {
    return absolute;
  }

  /** Joins {@code other} onto this path the way a shell would: an absolute other wins. */
  LexicalPath resolve(LexicalPath other) {
    if (other.absolute) {
      String otherDrive = other.drive.isEmpty() ? drive : other.drive;
      return new LexicalPath(otherDrive, true, new ArrayList<>(other.segments), windows);
    }
    if (!other.drive.isEmpty() && !sameDrive(other)) {
      // drive-relative path on another drive, nothing to anchor it to
      return new LexicalPath(other.drive, true, new ArrayList<>(other.segments), windows);
    }
    List<String> joined = new ArrayList<>(segments);
    collapse(joined, other.segments.toArray(new String[0]), absolute);
    return new LexicalPath(drive, absolute, joined, windows);
  }

  /**
   * Segments leading from this path to {@code target}, or {@code null} when the two paths live on
   * different drives and no relative path exists.
   */
  List<String> relativize(LexicalPath target) {
    if (!sameDrive(target)) {
      return null;
    }
    int common = 0;
    int max = Math.min(segments.size(), target.segments.size());
    while (common < max && sameSegment(segments.get(common), target.segments.get(common))) {
      common++;
    }
    List<String> relative = new ArrayList<>();
    for (int i = common; i < segments.size(); i++) {
      relative.add(PARENT);
    }
    relative.addAll(target.segments.subList(common, target.segments.size()));
    return relative;
  }

  static boolean escapes(List<String> relative) {
    return relative == null || (!relative.isEmpty() && PARENT.equals(relative.get(0)));
  }

  private boolean sameDrive(LexicalPath other) {
    return drive.equalsIgnoreCase(other.drive);
  }

  private boolean sameSegment(String a, String b) {
    return windows ? a.equalsIgnoreCase(b) : a.equals(b);
  }

  @Override
  public String toString() {
    String joined = String.join("/", segments);
    if (absolute) {
      return drive + "/" + joined;
    }
    return joined.isEmpty() ? drive + CURRENT : drive + joined;
  }
}
