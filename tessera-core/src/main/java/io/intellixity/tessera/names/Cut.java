package io.intellixity.tessera.names;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Filter on a level to an ordered, non-empty list of member ids.
 * <p>
 * Textual form: {@code [~]dimension.hierarchy.level.member[,member...]}; the {@code ~} prefix makes the cut
 * exclusive. Member ids are the fourth segment onwards, so ids may themselves contain dots.
 */
public record Cut(LevelName levelName, List<String> members, boolean exclude) {
  public static final char EXCLUDE_PREFIX = '~';

  public Cut {
    Objects.requireNonNull(levelName, "levelName");
    if (members == null || members.isEmpty()) {
      throw new NameParseException("Cut on '" + levelName + "' has no members");
    }
    members = List.copyOf(members);
  }

  public Cut(LevelName levelName, List<String> members) {
    this(levelName, members, false);
  }

  public static Cut parse(String s) {
    if (s == null) throw new NameParseException("Could not parse cut from null");
    String raw = s.trim();
    boolean exclude = !raw.isEmpty() && raw.charAt(0) == EXCLUDE_PREFIX;
    if (exclude) raw = raw.substring(1);

    String[] parts = raw.split("\\.", 4);
    if (parts.length != 4 || parts[3].isBlank()) {
      throw new NameParseException("Could not parse a cut from '" + s + "': expected dimension.hierarchy.level.member");
    }
    LevelName ln = LevelName.fromList(List.of(parts[0], parts[1], parts[2]));

    List<String> members = new ArrayList<>();
    for (String m : parts[3].split(",")) {
      String t = m.trim();
      if (t.isEmpty()) throw new NameParseException("Could not parse a cut from '" + s + "': empty member id");
      members.add(t);
    }
    return new Cut(ln, members, exclude);
  }

  @Override
  public String toString() {
    return (exclude ? String.valueOf(EXCLUDE_PREFIX) : "") + levelName + "." + String.join(",", members);
  }
}
