package com.flamingo.ai.notebook.integration.extraction;

import com.flamingo.ai.notebook.config.NotebookProperties;
import com.flamingo.ai.notebook.domain.model.SourceOrigin;
import com.flamingo.ai.notebook.exception.ExtractionFailedException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.BodyContentHandler;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.xml.sax.SAXException;

/**
 * {@link ContentExtractor} backed by Apache Tika for files and fetched URLs and by commonmark for
 * scraped Markdown. Pasted text is passed through after normalization.
 */
@Component
@Slf4j
public class TikaContentExtractor implements ContentExtractor {

  private static final Parser MARKDOWN_PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("(\\r?\\n\\s*){3,}");
  private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+(?=\\r?\\n)");

  private final WebClient webClient;
  private final Duration fetchTimeout;

  public TikaContentExtractor(NotebookProperties properties) {
    NotebookProperties.Extraction extraction = properties.getExtraction();
    this.fetchTimeout = extraction.getTimeout();
    this.webClient =
        WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, extraction.getUserAgent())
            .codecs(
                configurer -> configurer.defaultCodecs().maxInMemorySize(extraction.getMaxUrlBytes()))
            .build();
  }

  @Override
  public ExtractedContent extract(SourceOrigin origin) {
    if (origin instanceof SourceOrigin.Text text) {
      return ExtractedContent.of(requireContent(normalize(text.text()), "Source text is empty"));
    }
    if (origin instanceof SourceOrigin.ScrapedPage page) {
      String rendered = TEXT_RENDERER.render(MARKDOWN_PARSER.parse(page.markdown()));
      return ExtractedContent.of(requireContent(normalize(rendered), "Scraped page is empty"));
    }
    if (origin instanceof SourceOrigin.File file) {
      return extractFile(Path.of(file.path()));
    }
    if (origin instanceof SourceOrigin.Url url) {
      return extractUrl(url.url());
    }
    throw ExtractionFailedException.permanent("Unsupported origin type: " + origin.type());
  }

  private ExtractedContent extractFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw ExtractionFailedException.permanent("File not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, path.getFileName().toString(), null);
    } catch (IOException e) {
      throw ExtractionFailedException.transientFailure("Could not read file: " + path, e);
    }
  }

  private ExtractedContent extractUrl(String url) {
    byte[] body;
    String contentType;
    try {
      var response =
          webClient.get().uri(url).retrieve().toEntity(byte[].class).block(fetchTimeout);
      if (response == null || response.getBody() == null || response.getBody().length == 0) {
        throw ExtractionFailedException.permanent("Empty response from " + url);
      }
      body = response.getBody();
      contentType =
          response.getHeaders().getContentType() != null
              ? response.getHeaders().getContentType().toString()
              : null;
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      String reason = "Fetching " + url + " returned HTTP " + status;
      if (status == 429 || e.getStatusCode().is5xxServerError()) {
        throw ExtractionFailedException.transientFailure(reason, e);
      }
      throw ExtractionFailedException.permanent(reason);
    } catch (WebClientRequestException e) {
      throw ExtractionFailedException.transientFailure("Could not reach " + url, e);
    } catch (IllegalStateException e) {
      // block(timeout) reports an elapsed timeout as IllegalStateException
      throw ExtractionFailedException.transientFailure("Timed out fetching " + url, e);
    } catch (IllegalArgumentException e) {
      throw ExtractionFailedException.permanent("Invalid URL: " + url);
    }

    try (InputStream in = new ByteArrayInputStream(body)) {
      return parse(in, url, contentType);
    } catch (IOException e) {
      throw ExtractionFailedException.transientFailure("Could not read response of " + url, e);
    }
  }

  private ExtractedContent parse(InputStream in, String resourceName, String contentType)
      throws IOException {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, resourceName);
    if (contentType != null) {
      metadata.set(Metadata.CONTENT_TYPE, contentType);
    }
    try {
      parser.parse(in, handler, metadata);
    } catch (TikaException | SAXException e) {
      log.warn("Tika could not parse {}: {}", resourceName, e.getMessage());
      throw ExtractionFailedException.permanent(
          "Unsupported or corrupt content in " + resourceName + ": " + e.getMessage());
    }
    String text = requireContent(normalize(handler.toString()), "No text found in " + resourceName);
    String title = metadata.get(TikaCoreProperties.TITLE);
    log.debug("Extracted {} chars from {}", text.length(), resourceName);
    return new ExtractedContent(text, title == null || title.isBlank() ? null : title.strip());
  }

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = TRAILING_SPACES.matcher(text).replaceAll("");
    return EXCESS_BLANK_LINES.matcher(trimmed).replaceAll("\n\n").strip();
  }

  private static String requireContent(String text, String reason) {
    if (text.isBlank()) {
      throw ExtractionFailedException.permanent(reason);
    }
    return text;
  }
}
