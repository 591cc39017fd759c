package io.intellixity.tessera.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the active {@link Schema}.
 * <p>
 * Readers take a snapshot with {@link #current()}; {@link #reload(Schema)} swaps the whole snapshot at once.
 */
public final class SchemaRegistry {
  private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

  private final AtomicReference<Schema> ref;

  public SchemaRegistry(Schema initial) {
    this.ref = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  public Schema current() {
    return ref.get();
  }

  /** Installs {@code next} and returns the snapshot it replaced. */
  public Schema reload(Schema next) {
    Objects.requireNonNull(next, "next");
    Schema prev = ref.getAndSet(next);
    log.info("tessera.schema reloaded cubes={} previousCubes={}", next.cubes().size(), prev.cubes().size());
    return prev;
  }
}
