package com.receptionkit.backend.workflow.domain;

import com.receptionkit.backend.shared.json.AbstractJacksonJsonAttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = false)
public class NodeStyleConverter extends AbstractJacksonJsonAttributeConverter<NodeStyle> {

  public NodeStyleConverter() {
    super(NodeStyle.class);
  }
}
