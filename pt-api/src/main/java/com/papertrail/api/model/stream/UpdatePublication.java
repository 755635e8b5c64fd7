package com.papertrail.api.model.stream;

import com.papertrail.api.model.Publication;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePublication implements Streamable {
  public static final String TYPE = "update:publication";

  private Publication payload;
}
