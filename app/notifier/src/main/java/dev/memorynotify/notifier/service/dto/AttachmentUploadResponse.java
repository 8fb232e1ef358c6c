/*
 * Where: Push service DTO
 * What: Response of the attachment upload (PUT /{topic})
 * Why: Only the hosted attachment URL is reused for the Attach header
 */
package dev.memorynotify.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AttachmentUploadResponse(Attachment attachment) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Attachment(String url) {}
}
