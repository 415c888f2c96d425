package ca.gc.cra.formdata.infrastructure.introspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.formdata.application.port.EncodingContext;
import ca.gc.cra.formdata.domain.value.FormFile;
import ca.gc.cra.formdata.domain.value.Traversable;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Calendar;
import java.util.Currency;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.TimeZone;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ReflectiveValueIntrospectorTest {
  private final ReflectiveValueIntrospector introspector = new ReflectiveValueIntrospector();

  @Test
  void scalarsBecomeCanonicalText() throws Exception {
    assertEquals(Traversable.text("Ada"), describe("Ada"));
    assertEquals(Traversable.text("ab"), describe(new StringBuilder("ab")));
    assertEquals(Traversable.text("42"), describe(42));
    assertEquals(Traversable.text("-7"), describe(-7L));
    assertEquals(Traversable.text("3.5"), describe(3.5d));
    assertEquals(Traversable.text("0.25"), describe(0.25f));
    assertEquals(Traversable.text("1000"), describe(new BigDecimal("1E+3")));
    assertEquals(Traversable.text("123456789012345678901234567890"),
        describe(new BigInteger("123456789012345678901234567890")));
    assertEquals(Traversable.text("true"), describe(true));
    assertEquals(Traversable.text("x"), describe('x'));
    assertEquals(Traversable.text("ACTIVE"), describe(Status.ACTIVE));
    assertEquals(Traversable.text("2024-01-02"), describe(LocalDate.of(2024, 1, 2)));
    assertEquals(Traversable.text("PT1M"), describe(Duration.ofMinutes(1)));
    assertEquals(Traversable.text("https://example.org/a"), describe(URI.create("https://example.org/a")));
    UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    assertEquals(Traversable.text(id.toString()), describe(id));
  }

  @Test
  void legacyJdkValuesAreLeavesNotBeans() throws Exception {
    Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("America/Toronto"));
    calendar.setTimeInMillis(86_400_000L);

    assertEquals(Traversable.text("1970-01-01T00:00:00Z"), describe(new Date(0)));
    assertEquals(Traversable.text("1970-01-01T00:00:00Z"), describe(new java.sql.Date(0)));
    assertEquals(Traversable.text("1970-01-02T00:00:00Z"), describe(calendar));
    assertEquals(Traversable.text("en-CA"), describe(Locale.CANADA));
    assertEquals(Traversable.text("UTC"), describe(TimeZone.getTimeZone("UTC")));
    assertEquals(Traversable.text("CAD"), describe(Currency.getInstance("CAD")));
  }

  @Test
  void missingValuesAreAbsent() throws Exception {
    assertSame(Traversable.Absent.INSTANCE, describe(null));
    assertSame(Traversable.Absent.INSTANCE, describe(Optional.empty()));
    assertSame(Traversable.Absent.INSTANCE, describe(OptionalInt.empty()));
    assertSame(Traversable.Absent.INSTANCE, describe(OptionalLong.empty()));
    assertSame(Traversable.Absent.INSTANCE, describe(OptionalDouble.empty()));
  }

  @Test
  void presentOptionalsAreUnwrapped() throws Exception {
    assertEquals(Traversable.text("x"), describe(Optional.of("x")));
    assertEquals(Traversable.text("5"), describe(OptionalInt.of(5)));
    assertEquals(Traversable.text("9"), describe(OptionalLong.of(9)));
    assertEquals(Traversable.text("1.5"), describe(OptionalDouble.of(1.5)));
  }

  @Test
  void bytesAndFilesBecomeLeaves() throws Exception {
    ByteBuffer buffer = ByteBuffer.wrap(new byte[] {9, 1, 2});
    buffer.position(1);

    assertEquals(Traversable.binary(new byte[] {1, 2}), describe(new byte[] {1, 2}));
    assertEquals(Traversable.binary(new byte[] {1, 2}), describe(buffer));
    assertEquals(1, buffer.position());

    Traversable.Leaf file = assertInstanceOf(Traversable.Leaf.class,
        describe(new FormFile("a.txt", "text/plain", new byte[] {'a'})));
    assertEquals(Traversable.Leaf.Kind.FILE, file.kind());
    assertEquals("a.txt", file.filename());
    assertEquals("text/plain", file.contentType());
  }

  @Test
  void traversableValuesPassThrough() throws Exception {
    Traversable.Record record = Traversable.record().field("a", 1).build();

    assertSame(record, describe(record));
  }

  @Test
  void recordComponentsInDeclarationOrder() throws Exception {
    Traversable.Record record = assertInstanceOf(Traversable.Record.class,
        describe(new Person("Ada", 36, "secret")));

    assertEquals(List.of("full_name", "age"), fieldNames(record));
    assertEquals("Ada", record.fields().get(0).value());
    assertEquals(36, record.fields().get(1).value());
  }

  @Test
  void beansUseJacksonProperties() throws Exception {
    Traversable.Record record = assertInstanceOf(Traversable.Record.class, describe(new Account()));

    assertEquals(List.of("title", "active", "owner_id"), fieldNames(record));
    assertEquals("Savings", record.fields().get(0).value());
    assertEquals(Boolean.TRUE, record.fields().get(1).value());
    assertEquals(17L, record.fields().get(2).value());
  }

  @Test
  void getterFailurePropagatesOriginalException() throws Exception {
    Traversable.Record record = assertInstanceOf(Traversable.Record.class, describe(new Exploding()));

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> record.fields().get(0).value());
    assertEquals("not loaded", ex.getMessage());
  }

  @Test
  void mapsBecomeRecordsInIterationOrder() throws Exception {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put("b", "2");
    map.put(1, "one");
    map.put("a", null);

    Traversable.Record record = assertInstanceOf(Traversable.Record.class, describe(map));

    assertEquals(List.of("b", "1", "a"), fieldNames(record));
    assertEquals("one", record.fields().get(1).value());
  }

  @Test
  void iterablesAndArraysBecomeSequences() throws Exception {
    Traversable.Sequence list = assertInstanceOf(Traversable.Sequence.class, describe(List.of("x", "y")));
    Traversable.Sequence deque = assertInstanceOf(Traversable.Sequence.class,
        describe(new ArrayDeque<>(List.of(3, 4))));
    Traversable.Sequence objects = assertInstanceOf(Traversable.Sequence.class,
        describe(new String[] {"p", null}));
    Traversable.Sequence ints = assertInstanceOf(Traversable.Sequence.class, describe(new int[] {1, 2, 3}));

    assertEquals(List.of("x", "y"), list.elements());
    assertEquals(List.of(3, 4), deque.elements());
    assertEquals(2, objects.elements().size());
    assertEquals(List.of(1, 2, 3), ints.elements());
  }

  private Traversable describe(Object value) throws Exception {
    return introspector.describe(value, EncodingContext.empty());
  }

  private static List<String> fieldNames(Traversable.Record record) {
    return record.fields().stream().map(Traversable.Field::name).toList();
  }

  enum Status {
    ACTIVE
  }

  record Person(@JsonProperty("full_name") String name, int age, @JsonIgnore String password) {}

  @JsonPropertyOrder({"title", "active", "owner_id"})
  static final class Account {
    public String getTitle() {
      return "Savings";
    }

    public boolean isActive() {
      return true;
    }

    @JsonProperty("owner_id")
    public long getOwnerId() {
      return 17L;
    }

    @JsonIgnore
    public String getPin() {
      return "0000";
    }
  }

  static final class Exploding {
    public String getDetails() {
      throw new IllegalStateException("not loaded");
    }
  }
}
