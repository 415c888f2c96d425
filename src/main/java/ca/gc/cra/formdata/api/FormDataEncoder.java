package ca.gc.cra.formdata.api;

import ca.gc.cra.formdata.application.encode.PartTreeBuilder;
import ca.gc.cra.formdata.application.port.EncodingContext;
import ca.gc.cra.formdata.application.port.MetricsPort;
import ca.gc.cra.formdata.application.port.ValueIntrospector;
import ca.gc.cra.formdata.config.EncoderConfig;
import ca.gc.cra.formdata.domain.error.FormDataEncodingException;
import ca.gc.cra.formdata.domain.part.NamedPart;
import ca.gc.cra.formdata.domain.util.Utf8;
import ca.gc.cra.formdata.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.formdata.infrastructure.introspect.ReflectiveValueIntrospector;
import ca.gc.cra.formdata.infrastructure.protocol.multipart.MultipartSerializer;
import ca.gc.cra.formdata.validation.Strings;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point that encodes a structured value as a {@code multipart/form-data} body.
 * <p><strong>Why:</strong> Combines part discovery and framing so callers only supply a value and a boundary.</p>
 * <p><strong>Role:</strong> API facade over {@link PartTreeBuilder} and {@link MultipartSerializer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode into text, bytes, a {@link GrowableBuffer}, or an {@link OutputStream}.</li>
 *   <li>Hand caller user info to the {@link ValueIntrospector} unchanged.</li>
 *   <li>Emit {@code formdata.encode.*} metrics and DEBUG logs per call.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; a single instance may serve concurrent callers.</p>
 *
 * <pre>{@code
 * FormDataEncoder encoder = new FormDataEncoder();
 * byte[] body = encoder.encodeBytes(new Upload("report", FormFile.of(bytes)), "----7MA4YWxk");
 * request.header("Content-Type", FormDataEncoder.contentType("----7MA4YWxk"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class FormDataEncoder {
  private static final Logger log = LoggerFactory.getLogger(FormDataEncoder.class);

  static final String METRIC_SUCCESS = "formdata.encode.success";
  static final String METRIC_FAILURE = "formdata.encode.failure";
  static final String METRIC_PARTS = "formdata.encode.parts";
  static final String METRIC_BYTES = "formdata.encode.bytes";

  private final EncoderConfig config;
  private final ValueIntrospector introspector;
  private final MetricsPort metrics;
  private final EncodingContext context;
  private final PartTreeBuilder builder;
  private final MultipartSerializer serializer;

  /**
   * Creates an encoder with default configuration, reflective introspection, and no metrics.
   */
  public FormDataEncoder() {
    this(EncoderConfig.defaults(), new ReflectiveValueIntrospector(), MetricsPort.NO_OP);
  }

  /**
   * Creates an encoder with reflective introspection and no metrics.
   *
   * @param config encoder configuration; must not be {@code null}
   */
  public FormDataEncoder(EncoderConfig config) {
    this(config, new ReflectiveValueIntrospector(), MetricsPort.NO_OP);
  }

  /**
   * Creates an encoder from explicit collaborators.
   *
   * @param config encoder configuration; must not be {@code null}
   * @param introspector value-inspection strategy; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public FormDataEncoder(EncoderConfig config, ValueIntrospector introspector, MetricsPort metrics) {
    this(config, introspector, metrics, EncodingContext.empty());
  }

  private FormDataEncoder(EncoderConfig config, ValueIntrospector introspector, MetricsPort metrics,
      EncodingContext context) {
    this.config = Objects.requireNonNull(config, "config");
    this.introspector = Objects.requireNonNull(introspector, "introspector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.context = Objects.requireNonNull(context, "context");
    this.builder = new PartTreeBuilder(introspector, config);
    this.serializer = new MultipartSerializer();
  }

  /**
   * Returns a copy of this encoder that hands {@code userInfo} to the introspector on every call.
   *
   * @param userInfo caller context; copied, keys and values must not be {@code null}
   * @return new encoder sharing configuration, introspector, and metrics
   */
  public FormDataEncoder withUserInfo(Map<String, Object> userInfo) {
    return new FormDataEncoder(config, introspector, metrics, new EncodingContext(userInfo));
  }

  /**
   * Returns the user info handed to the introspector.
   *
   * @return immutable user info
   */
  public Map<String, Object> userInfo() {
    return context.userInfo();
  }

  /**
   * Returns the configuration in use.
   *
   * @return encoder configuration
   */
  public EncoderConfig config() {
    return config;
  }

  /**
   * Builds the {@code Content-Type} header value that matches bodies produced with {@code boundary}.
   *
   * @param boundary RFC 2046 boundary
   * @return {@code multipart/form-data; boundary=<boundary>}
   * @throws IllegalArgumentException when the boundary is malformed
   */
  public static String contentType(String boundary) {
    Strings.requireBoundary(boundary);
    return "multipart/form-data; boundary=" + boundary;
  }

  /**
   * Lists the parts that {@code value} encodes to, without framing.
   *
   * @param value record-like root value
   * @return parts in output order
   * @throws FormDataEncodingException when the root is not record-like or inspecting a value fails
   */
  public List<NamedPart> parts(Object value) throws FormDataEncodingException {
    return builder.parts(value, context);
  }

  /**
   * Encodes {@code value} and returns the body as UTF-8 text.
   *
   * <p>Binary bodies that are not valid UTF-8 are decoded with replacement characters; use
   * {@link #encodeBytes(Object, String)} when the value carries files or raw bytes.</p>
   *
   * @param value record-like root value
   * @param boundary RFC 2046 boundary
   * @return multipart body
   * @throws FormDataEncodingException when traversal or serialization fails
   * @throws IllegalArgumentException when the boundary is not 1 to 70 RFC 2046 boundary characters or ends with
   *     a space; nothing is written
   */
  public String encode(Object value, String boundary) throws FormDataEncodingException {
    byte[] body = encodeBytes(value, boundary);
    return Utf8.decode(body, 0, body.length);
  }

  /**
   * Encodes {@code value} into a byte array.
   *
   * @param value record-like root value
   * @param boundary RFC 2046 boundary
   * @return multipart body
   * @throws FormDataEncodingException when traversal or serialization fails
   * @throws IllegalArgumentException when the boundary is not 1 to 70 RFC 2046 boundary characters or ends with
   *     a space; nothing is written
   */
  public byte[] encodeBytes(Object value, String boundary) throws FormDataEncodingException {
    try {
      List<NamedPart> parts = builder.parts(value, context);
      byte[] body = serializer.serialize(parts, boundary);
      recordSuccess(parts.size(), body.length);
      return body;
    } catch (FormDataEncodingException ex) {
      throw recordFailure(ex);
    }
  }

  /**
   * Appends the encoded body to {@code sink}. The sink is left untouched when encoding fails.
   *
   * @param value record-like root value
   * @param boundary RFC 2046 boundary
   * @param sink growable destination; must not be {@code null}
   * @throws FormDataEncodingException when traversal or serialization fails
   * @throws IllegalArgumentException when the boundary is not 1 to 70 RFC 2046 boundary characters or ends with
   *     a space; nothing is written
   */
  public void encodeInto(Object value, String boundary, GrowableBuffer sink) throws FormDataEncodingException {
    Objects.requireNonNull(sink, "sink");
    try {
      List<NamedPart> parts = builder.parts(value, context);
      long written = serializer.serialize(parts, boundary, sink);
      recordSuccess(parts.size(), written);
    } catch (FormDataEncodingException ex) {
      throw recordFailure(ex);
    }
  }

  /**
   * Streams the encoded body to {@code out}. Nothing is written when traversal or validation fails; the stream is
   * neither flushed nor closed.
   *
   * @param value record-like root value
   * @param boundary RFC 2046 boundary
   * @param out destination stream; must not be {@code null}
   * @throws FormDataEncodingException when traversal or serialization fails
   * @throws IllegalArgumentException when the boundary is not 1 to 70 RFC 2046 boundary characters or ends with
   *     a space; nothing is written
   * @throws IOException when writing to {@code out} fails
   */
  public void encodeTo(Object value, String boundary, OutputStream out)
      throws FormDataEncodingException, IOException {
    Objects.requireNonNull(out, "out");
    try {
      List<NamedPart> parts = builder.parts(value, context);
      long written = serializer.serialize(parts, boundary, out);
      recordSuccess(parts.size(), written);
    } catch (FormDataEncodingException ex) {
      throw recordFailure(ex);
    } catch (IOException ex) {
      metrics.increment(METRIC_FAILURE);
      log.debug("Multipart stream write failed", ex);
      throw ex;
    }
  }

  private void recordSuccess(int parts, long bytes) {
    metrics.increment(METRIC_SUCCESS);
    metrics.observe(METRIC_PARTS, parts);
    metrics.observe(METRIC_BYTES, bytes);
    log.debug("Encoded {} parts into {} bytes", parts, bytes);
  }

  private FormDataEncodingException recordFailure(FormDataEncodingException ex) {
    metrics.increment(METRIC_FAILURE);
    log.debug("Multipart encoding failed: reason={} path={}", ex.reason(), ex.path().orElse("<none>"), ex);
    return ex;
  }
}
