package com.flamingo.ai.coursegate.api.dto.request;

import com.flamingo.ai.coursegate.domain.model.Item;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one item to classify. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemRequest {

  @NotNull(message = "Item id is required")
  private Integer id;

  @NotBlank(message = "Item text is required")
  private String text;

  public Item toItem() {
    return Item.of(id, text);
  }
}
