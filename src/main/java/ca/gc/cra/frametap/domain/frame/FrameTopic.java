package ca.gc.cra.frametap.domain.frame;

/**
 * Logical topics carried in part 0 of every wire message.
 *
 * @since 0.1.0
 */
public enum FrameTopic {
  /** Raw pixel buffer plus metadata. */
  VIDEO("VideoFrame", 6),
  /** JPEG-compressed buffer plus metadata. */
  JPEG("JpegFrame", 6),
  /** Annotation-only log record. */
  LOG("LogFrame", 4),
  /** Anything else; never produced by a well-behaved publisher. */
  UNKNOWN("", -1);

  private final String wireName;
  private final int partCount;

  FrameTopic(String wireName, int partCount) {
    this.wireName = wireName;
    this.partCount = partCount;
  }

  /**
   * Returns the topic name as it appears on the wire (without any source suffix).
   *
   * @return wire name; empty for {@link #UNKNOWN}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the exact number of message parts this topic requires.
   *
   * @return part count; {@code -1} for {@link #UNKNOWN}
   */
  public int partCount() {
    return partCount;
  }

  /**
   * Indicates whether messages of this topic carry an image buffer.
   *
   * @return {@code true} for {@link #VIDEO} and {@link #JPEG}
   */
  public boolean carriesImage() {
    return this == VIDEO || this == JPEG;
  }

  /**
   * Maps a logical (suffix-free) topic name to its constant.
   *
   * @param logical topic name such as {@code VideoFrame}
   * @return matching topic or {@link #UNKNOWN}
   */
  public static FrameTopic fromWireName(String logical) {
    if (logical == null) {
      return UNKNOWN;
    }
    for (FrameTopic topic : values()) {
      if (topic != UNKNOWN && topic.wireName.equals(logical)) {
        return topic;
      }
    }
    return UNKNOWN;
  }
}
