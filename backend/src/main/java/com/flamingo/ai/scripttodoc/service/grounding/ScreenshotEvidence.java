package com.flamingo.ai.scripttodoc.service.grounding;

import java.util.List;

/**
 * Analysed screenshot captured alongside the transcript.
 *
 * @param filename screenshot file name
 * @param content text description or OCR output of the screenshot
 * @param uiElements labelled UI elements found on screen
 */
public record ScreenshotEvidence(String filename, String content, List<UiElement> uiElements) {

  public ScreenshotEvidence {
    filename = filename == null ? "unknown" : filename;
    content = content == null ? "" : content;
    uiElements = uiElements == null ? List.of() : List.copyOf(uiElements);
  }

  /**
   * A labelled element on screen.
   *
   * @param text visible label
   * @param type element kind, e.g. button or menu
   */
  public record UiElement(String text, String type) {

    public UiElement {
      text = text == null ? "" : text;
      type = type == null ? "unknown" : type;
    }
  }
}
