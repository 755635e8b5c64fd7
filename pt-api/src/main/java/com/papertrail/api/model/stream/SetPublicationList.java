package com.papertrail.api.model.stream;

import com.papertrail.api.model.Publication;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replaces the list of publications shown for a query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetPublicationList implements Streamable {
  public static final String TYPE = "set:publication:list";

  private List<Publication> payload;
}
