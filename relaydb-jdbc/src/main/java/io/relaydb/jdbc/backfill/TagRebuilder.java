package io.relaydb.jdbc.backfill;

import io.relaydb.jdbc.JdbcTemplate;
import io.relaydb.jdbc.spi.Dialect;
import io.relaydb.jdbc.tx.JdbcTransactionManager;
import io.relaydb.migration.Backfill;
import io.relaydb.migration.BackfillContext;
import io.relaydb.spi.ProgressListener;
import io.relaydb.tag.EventContentException;
import io.relaydb.tag.EventTag;
import io.relaydb.tag.TagExtractor;
import io.relaydb.tag.TagValue;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Regenerates the whole {@code tag} table from the stored event content.
 *
 * <p>Two transactions are used. A read-only one streams {@code event} rows ordered by
 * id through a cursor, so memory stays bounded however large the table is. A write
 * one first deletes every tag row and then inserts the tags extracted from each
 * event, choosing {@code value} or {@code value_hex} per {@link TagValue}. The write
 * transaction commits only after the last event; any failure rolls it back and the
 * tag table keeps its previous rows.
 *
 * <p>There is no checkpoint. An interrupted rebuild starts again from the first event.
 */
public final class TagRebuilder implements Backfill {
  private static final Logger logger = Logger.getLogger(TagRebuilder.class.getName());

  static final String NAME = "rebuilding tags table";

  private static final String DELETE_TAGS = "DELETE FROM tag";
  private static final String COUNT_EVENTS = "SELECT COUNT(*) FROM event";
  private static final String SELECT_EVENTS = "SELECT id, \"content\" FROM event ORDER BY id";

  private final Dialect dialect;
  private final TagExtractor extractor;

  public TagRebuilder(Dialect dialect) {
    this(dialect, new TagExtractor());
  }

  public TagRebuilder(Dialect dialect, TagExtractor extractor) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void run(BackfillContext context) throws SQLException {
    long start = System.nanoTime();
    JdbcTransactionManager txManager = new JdbcTransactionManager(context.connectionProvider());
    RebuildPass pass;
    try (JdbcTransactionManager.Transaction read = txManager.beginReadOnly();
         JdbcTransactionManager.Transaction write = txManager.begin()) {
      int deleted = JdbcTemplate.update(write.connection(), DELETE_TAGS);
      logger.fine(() -> "Deleted " + deleted + " tag rows before rebuild");

      long total = JdbcTemplate.queryForLong(read.connection(), COUNT_EVENTS);
      notifySafely(context.progress(), p -> p.started(NAME, total));

      try (PreparedStatement insertValue = write.connection().prepareStatement(dialect.insertTagValueSql());
           PreparedStatement insertHex = write.connection().prepareStatement(dialect.insertTagHexSql())) {
        pass = new RebuildPass(insertValue, insertHex, context.progress(), total);
        JdbcTemplate.stream(read.connection(), SELECT_EVENTS, context.fetchSize(), pass);
      }
      write.commit();
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    context.metrics().incrementBackfillEvents(pass.events);
    context.metrics().incrementBackfillTags(pass.tags);
    notifySafely(context.progress(), p -> p.completed(NAME, pass.events, elapsed));
    logger.info(() -> "Rebuilt tags for " + pass.events + " events (" + pass.tags + " rows) in "
        + elapsed.toMillis() + " ms");
  }

  private static void notifySafely(ProgressListener listener, ProgressCall call) {
    try {
      call.invoke(listener);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Progress listener failed", e);
    }
  }

  @FunctionalInterface
  private interface ProgressCall {
    void invoke(ProgressListener listener);
  }

  /**
   * Row callback for one rebuild: extracts and inserts the tags of each streamed event.
   */
  private final class RebuildPass implements JdbcTemplate.RowCallback {
    private final PreparedStatement insertValue;
    private final PreparedStatement insertHex;
    private final ProgressListener progress;
    private final long total;
    private long events;
    private long tags;

    private RebuildPass(PreparedStatement insertValue, PreparedStatement insertHex,
        ProgressListener progress, long total) {
      this.insertValue = insertValue;
      this.insertHex = insertHex;
      this.progress = progress;
      this.total = total;
    }

    @Override
    public void processRow(ResultSet rs) throws SQLException {
      byte[] eventId = rs.getBytes(1);
      byte[] content = rs.getBytes(2);
      List<EventTag> eventTags;
      try {
        eventTags = extractor.extract(content);
      } catch (EventContentException e) {
        throw new EventContentException("Cannot decode content of event " + HexFormat.of().formatHex(eventId), e);
      }
      for (EventTag tag : eventTags) {
        tags += insert(eventId, tag);
      }
      events++;
      long processed = events;
      notifySafely(progress, p -> p.advanced(NAME, processed, total));
    }

    private int insert(byte[] eventId, EventTag tag) throws SQLException {
      TagValue value = tag.value();
      PreparedStatement ps = value.isHex() ? insertHex : insertValue;
      ps.setBytes(1, eventId);
      ps.setString(2, tag.name());
      ps.setBytes(3, value.isHex() ? value.valueHex() : value.value());
      return ps.executeUpdate();
    }
  }
}
