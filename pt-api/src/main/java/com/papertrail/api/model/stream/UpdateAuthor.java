package com.papertrail.api.model.stream;

import com.papertrail.api.model.Author;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replaces one previously listed author, matched by scholar id, with its filled profile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAuthor implements Streamable {
  public static final String TYPE = "update:author";

  private Author payload;
}
