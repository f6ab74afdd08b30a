package com.flamingo.ai.scripttodoc.service.grounding;

/**
 * External reference material fetched for a transcript, such as product documentation.
 *
 * @param url where the material came from
 * @param title document title
 * @param content extracted text
 * @param type content type label
 * @param error fetch error message, null when the fetch succeeded
 */
public record KnowledgeSource(String url, String title, String content, String type, String error) {

  public static KnowledgeSource of(String url, String title, String content) {
    return new KnowledgeSource(url, title, content, "document", null);
  }

  public boolean isUsable() {
    return error == null && content != null && !content.isBlank();
  }

  public String displayTitle() {
    return title == null || title.isBlank() ? "Untitled" : title;
  }
}
