package ca.gc.cra.rulesync.domain.source;

/**
 * Payload families understood by the merge engine.
 *
 * @since 0.1.0
 */
public enum SourceKind {
  /** JSON document holding a {@code rules} array of {@code {type: [values]}} objects. */
  STRUCTURED_FRAGMENT,
  /** Line-oriented text: plain IP/domain lists, proxy rule lists or YAML {@code payload} documents. */
  LINE_LIST
}
