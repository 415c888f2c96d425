package ca.gc.cra.formdata.infrastructure.introspect;

import ca.gc.cra.formdata.application.port.EncodingContext;
import ca.gc.cra.formdata.application.port.ValueIntrospector;
import ca.gc.cra.formdata.domain.value.FormFile;
import ca.gc.cra.formdata.domain.value.Traversable;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import java.io.File;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Collections;
import java.util.Currency;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Default {@link ValueIntrospector} that discovers value shapes by type and reflection.
 * <p><strong>Why:</strong> Lets callers encode ordinary Java records, beans, maps, and collections without writing
 * mappings by hand.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the value-inspection port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@code null} and empty optionals are absent; present optionals are unwrapped.</li>
 *   <li>Strings, numbers, booleans, characters, enums, UUIDs, URIs, paths, and {@code java.time} values become
 *   UTF-8 text leaves.</li>
 *   <li>Legacy {@link Date} and {@link Calendar} values become ISO-8601 instants; {@link Locale} becomes its
 *   language tag, {@link TimeZone} its ID and {@link Currency} its ISO 4217 code.</li>
 *   <li>{@code byte[]} and {@link ByteBuffer} become raw binary leaves; {@link FormFile} becomes a file leaf.</li>
 *   <li>Maps become records in iteration order; iterables and arrays become sequences.</li>
 *   <li>Java records expose their components in declaration order, honoring {@link JsonProperty} and
 *   {@link JsonIgnore} on accessors.</li>
 *   <li>Other objects expose the bean properties Jackson would serialize, in Jackson's property order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; per-class property readers are cached in a concurrent map.</p>
 * <p><strong>Performance:</strong> Reflection metadata is resolved once per class; field values are read lazily
 * when the builder reaches them.</p>
 * <p><strong>Observability:</strong> Logs at DEBUG when a class is introspected for the first time.</p>
 *
 * @implNote Maps without a defined iteration order (e.g., {@link java.util.HashMap}) produce parts in an
 * unspecified order; use {@link java.util.LinkedHashMap} or {@link java.util.TreeMap} for reproducible output.
 * @since 0.1.0
 */
public final class ReflectiveValueIntrospector implements ValueIntrospector {
  private static final Logger log = LoggerFactory.getLogger(ReflectiveValueIntrospector.class);

  private final ObjectMapper mapper;
  private final ConcurrentMap<Class<?>, List<PropertyReader>> readers = new ConcurrentHashMap<>();

  /**
   * Creates an introspector backed by a default {@link ObjectMapper}.
   */
  public ReflectiveValueIntrospector() {
    this(new ObjectMapper());
  }

  /**
   * Creates an introspector using the bean visibility and naming rules of {@code mapper}.
   *
   * @param mapper Jackson mapper whose serialization config drives bean discovery; must not be {@code null}
   */
  public ReflectiveValueIntrospector(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public Traversable describe(Object value, EncodingContext context) {
    if (value == null) {
      return Traversable.Absent.INSTANCE;
    }
    if (value instanceof Traversable traversable) {
      return traversable;
    }
    if (value instanceof Optional<?> optional) {
      return optional.isPresent() ? describe(optional.get(), context) : Traversable.Absent.INSTANCE;
    }
    if (value instanceof OptionalInt optional) {
      return optional.isPresent() ? text(Integer.toString(optional.getAsInt())) : Traversable.Absent.INSTANCE;
    }
    if (value instanceof OptionalLong optional) {
      return optional.isPresent() ? text(Long.toString(optional.getAsLong())) : Traversable.Absent.INSTANCE;
    }
    if (value instanceof OptionalDouble optional) {
      return optional.isPresent() ? text(Double.toString(optional.getAsDouble())) : Traversable.Absent.INSTANCE;
    }
    if (value instanceof FormFile file) {
      return Traversable.file(file);
    }
    if (value instanceof byte[] bytes) {
      return Traversable.binary(bytes);
    }
    if (value instanceof ByteBuffer buffer) {
      byte[] copy = new byte[buffer.remaining()];
      buffer.duplicate().get(copy);
      return Traversable.binary(copy);
    }
    if (value instanceof CharSequence chars) {
      return text(chars.toString());
    }
    if (value instanceof Number number) {
      return text(number instanceof BigDecimal decimal ? decimal.toPlainString() : number.toString());
    }
    if (value instanceof Enum<?> constant) {
      return text(constant.name());
    }
    if (isTextual(value)) {
      return text(value.toString());
    }
    if (value instanceof Date date) {
      // java.sql.Date and Time reject toInstant()
      return text(Instant.ofEpochMilli(date.getTime()).toString());
    }
    if (value instanceof Calendar calendar) {
      return text(calendar.toInstant().toString());
    }
    if (value instanceof Locale locale) {
      return text(locale.toLanguageTag());
    }
    if (value instanceof TimeZone zone) {
      return text(zone.getID());
    }
    if (value instanceof Currency currency) {
      return text(currency.getCurrencyCode());
    }
    if (value instanceof Map<?, ?> map) {
      return mapRecord(map);
    }
    if (value instanceof Iterable<?> iterable) {
      List<Object> elements = new ArrayList<>();
      for (Object element : iterable) {
        elements.add(element);
      }
      return new Traversable.Sequence(elements);
    }
    Class<?> type = value.getClass();
    if (type.isArray()) {
      return arraySequence(value);
    }
    List<PropertyReader> properties = readers.computeIfAbsent(type, this::resolve);
    List<Traversable.Field> fields = new ArrayList<>(properties.size());
    for (PropertyReader property : properties) {
      fields.add(new Traversable.Field(property.name(), () -> property.read(value)));
    }
    return new Traversable.Record(fields);
  }

  private static Traversable text(String text) {
    return Traversable.text(text);
  }

  private static boolean isTextual(Object value) {
    return value instanceof Boolean
        || value instanceof Character
        || value instanceof UUID
        || value instanceof URI
        || value instanceof Path
        || value instanceof File
        || value instanceof ZoneId
        || value instanceof TemporalAccessor
        || value instanceof TemporalAmount;
  }

  private static Traversable mapRecord(Map<?, ?> map) {
    List<Traversable.Field> fields = new ArrayList<>(map.size());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      fields.add(Traversable.Field.of(String.valueOf(entry.getKey()), entry.getValue()));
    }
    return new Traversable.Record(fields);
  }

  private static Traversable arraySequence(Object array) {
    if (array instanceof Object[] objects) {
      return new Traversable.Sequence(Arrays.asList(objects));
    }
    int length = Array.getLength(array);
    List<Object> elements = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      elements.add(Array.get(array, i));
    }
    return new Traversable.Sequence(elements);
  }

  private List<PropertyReader> resolve(Class<?> type) {
    List<PropertyReader> properties = type.isRecord() ? recordComponents(type) : beanProperties(type);
    log.debug("Introspected {} properties for {}", properties.size(), type.getName());
    return Collections.unmodifiableList(properties);
  }

  private static List<PropertyReader> recordComponents(Class<?> type) {
    RecordComponent[] components = type.getRecordComponents();
    List<PropertyReader> properties = new ArrayList<>(components.length);
    for (RecordComponent component : components) {
      Method accessor = component.getAccessor();
      JsonIgnore ignore = accessor.getAnnotation(JsonIgnore.class);
      if (ignore != null && ignore.value()) {
        continue;
      }
      JsonProperty rename = accessor.getAnnotation(JsonProperty.class);
      String name = rename != null && !rename.value().isEmpty() ? rename.value() : component.getName();
      accessor.trySetAccessible();
      properties.add(new PropertyReader(name, accessor));
    }
    return properties;
  }

  private List<PropertyReader> beanProperties(Class<?> type) {
    JavaType javaType = mapper.constructType(type);
    BeanDescription description = mapper.getSerializationConfig().introspect(javaType);
    List<PropertyReader> properties = new ArrayList<>();
    for (BeanPropertyDefinition property : description.findProperties()) {
      if (!property.couldSerialize()) {
        continue;
      }
      AnnotatedMember accessor = property.getAccessor();
      if (accessor == null) {
        continue;
      }
      accessor.fixAccess(false);
      properties.add(new PropertyReader(property.getName(), accessor.getMember()));
    }
    return properties;
  }

  private record PropertyReader(String name, Member member) {
    Object read(Object target) throws Exception {
      try {
        if (member instanceof Method method) {
          return method.invoke(target);
        }
        return ((Field) member).get(target);
      } catch (InvocationTargetException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof Exception exception) {
          throw exception;
        }
        throw ex;
      }
    }
  }
}
