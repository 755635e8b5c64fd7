package com.papertrail.search;

import akka.NotUsed;
import akka.stream.javadsl.Flow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrail.api.model.stream.StreamMessage;

/**
 * Renders stream messages as server-sent event frames: {@code event: <event>}, then {@code data: <json>} with an
 * empty data line for a message without data, then a blank line.
 */
public class SseFrameEncoder {
  private final ObjectMapper objectMapper;

  public SseFrameEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public SseFrameEncoder() {
    this(new ObjectMapper());
  }

  public String encode(StreamMessage message) {
    String data;
    try {
      data = message.getData() == null ? "" : objectMapper.writeValueAsString(message.getData());
    } catch (JsonProcessingException e) {
      throw new SearchStreamException("Cannot serialize stream message " + message.getEvent(), e);
    }
    return "event: " + message.getEvent() + "\ndata: " + data + "\n\n";
  }

  public Flow<StreamMessage, String, NotUsed> flow() {
    return Flow.<StreamMessage>create().map(this::encode);
  }
}
