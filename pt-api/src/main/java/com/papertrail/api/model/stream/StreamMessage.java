package com.papertrail.api.model.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One server-sent event of a search stream. A {@value #FINISH_EVENT} message without data ends the stream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamMessage {
  public static final String MESSAGE_EVENT = "message";
  public static final String FINISH_EVENT = "finish";

  private String event;
  private Streamable data;

  public static StreamMessage message(Streamable data) {
    return new StreamMessage(MESSAGE_EVENT, data);
  }

  public static StreamMessage finish() {
    return new StreamMessage(FINISH_EVENT, null);
  }

  @JsonIgnore
  public boolean isFinish() {
    return FINISH_EVENT.equals(event);
  }
}
