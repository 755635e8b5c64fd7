package com.papertrail.api.model.stream;

import com.papertrail.api.model.Author;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replaces the list of authors shown for a query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetAuthorList implements Streamable {
  public static final String TYPE = "set:author:list";

  private List<Author> payload;
}
