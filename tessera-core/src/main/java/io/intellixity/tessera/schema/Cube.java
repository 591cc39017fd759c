package io.intellixity.tessera.schema;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Immutable cube definition: one fact table, its dimensions and measures. */
public record Cube(String name, Table table, List<Dimension> dimensions, List<Measure> measures,
                   int minAuthLevel, Map<String, String> annotations) {
  public Cube {
    if (name == null || name.isBlank()) throw new SchemaException("Cube name is blank");
    Objects.requireNonNull(table, "table");
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    measures = measures == null ? List.of() : List.copyOf(measures);
    annotations = annotations == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
  }

  public Optional<LevelRef> findLevel(LevelName ln) {
    for (Dimension d : dimensions) {
      if (!d.name().equals(ln.dimension())) continue;
      Optional<Hierarchy> h = d.hierarchy(ln.hierarchy());
      if (h.isEmpty()) return Optional.empty();
      int idx = h.get().indexOf(ln.level());
      if (idx < 0) return Optional.empty();
      return Optional.of(new LevelRef(ln, d, h.get(), h.get().levels().get(idx), idx));
    }
    return Optional.empty();
  }

  public LevelRef level(LevelName ln) {
    return findLevel(ln).orElseThrow(() -> new NotFoundException("Level '" + ln + "' not found in cube '" + name + "'"));
  }

  public Optional<Measure> findMeasure(MeasureName mn) {
    for (Measure m : measures) {
      if (m.name().equals(mn.name())) return Optional.of(m);
    }
    return Optional.empty();
  }

  public Measure measure(MeasureName mn) {
    return findMeasure(mn).orElseThrow(() -> new NotFoundException("Measure '" + mn + "' not found in cube '" + name + "'"));
  }

  /** Every level of every hierarchy, in declaration order. */
  public Set<LevelName> allLevelNames() {
    Set<LevelName> out = new LinkedHashSet<>();
    for (Dimension d : dimensions) {
      for (Hierarchy h : d.hierarchies()) {
        for (Level l : h.levels()) out.add(new LevelName(d.name(), h.name(), l.name()));
      }
    }
    return out;
  }

  public Set<MeasureName> allMeasureNames() {
    Set<MeasureName> out = new LinkedHashSet<>();
    for (Measure m : measures) out.add(new MeasureName(m.name()));
    return out;
  }

  /** Levels above {@code ln} in its hierarchy, root first. */
  public List<LevelName> levelParents(LevelName ln) {
    LevelRef ref = level(ln);
    List<LevelName> out = new ArrayList<>();
    for (int i = 0; i < ref.depth(); i++) {
      out.add(new LevelName(ln.dimension(), ln.hierarchy(), ref.hierarchy().levels().get(i).name()));
    }
    return out;
  }

  public CubeSourceData sourceData() {
    List<String> names = new ArrayList<>();
    for (Measure m : measures) names.add(m.name());
    return new CubeSourceData(name, table, names, annotations);
  }
}
