package io.intellixity.tessera.names;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class LevelNameTest {

  @Test
  void listAndStringFormsAreEqual() {
    LevelName a = LevelName.fromList(List.of("foo", "bar", "baz"));
    LevelName b = LevelName.parse("foo.bar.baz");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals("foo.bar.baz", b.toString());
  }

  @Test
  void rejectsWrongSegmentCount() {
    assertThrows(NameParseException.class, () -> LevelName.parse("foo.bar"));
    assertThrows(NameParseException.class, () -> LevelName.parse("a.b.c.d"));
    assertThrows(NameParseException.class, () -> LevelName.fromList(List.of("a", "b")));
  }

  @Test
  void rejectsEmptySegment() {
    NameParseException e = assertThrows(NameParseException.class, () -> LevelName.parse("foo..baz"));
    assertTrue(e.getMessage().contains("foo..baz"));
    assertThrows(NameParseException.class, () -> LevelName.parse("foo.bar."));
  }

  @Test
  void usableAsSetKey() {
    Set<LevelName> s = new HashSet<>();
    s.add(LevelName.parse("geo.country.state"));
    s.add(LevelName.fromList(List.of("geo", "country", "state")));
    assertEquals(1, s.size());
  }
}
