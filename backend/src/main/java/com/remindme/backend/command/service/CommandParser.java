package com.remindme.backend.command.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.remindme.backend.command.api.AssistantCommandPayload;
import com.remindme.backend.command.model.ReminderCommand;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.UpstreamFailureKind;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the raw JSON emitted by the model and hands it to the {@link CommandValidator}. Output that
 * is not a JSON command at all is a permanent upstream failure; a well-formed command with bad
 * fields is a validation failure addressed by field.
 */
@Component
public class CommandParser {

  private static final Logger log = LoggerFactory.getLogger(CommandParser.class);
  private static final Pattern CODE_FENCE =
      Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private final ObjectMapper objectMapper;
  private final CommandValidator validator;

  public CommandParser(ObjectMapper objectMapper, CommandValidator validator) {
    this.objectMapper =
        objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.validator = validator;
  }

  public ReminderCommand parse(String rawJson) {
    return validator.validate(read(rawJson));
  }

  AssistantCommandPayload read(String rawJson) {
    String json = unwrap(rawJson);
    if (!StringUtils.hasText(json)) {
      throw new PermanentUpstreamException(
          UpstreamFailureKind.MALFORMED_RESPONSE, "Model returned an empty command");
    }
    try {
      return objectMapper.readValue(json, AssistantCommandPayload.class);
    } catch (InvalidTypeIdException ex) {
      throw new PermanentUpstreamException(
          UpstreamFailureKind.MALFORMED_RESPONSE, "Model returned an unknown command", ex);
    } catch (JsonMappingException ex) {
      String field = fieldPath(ex);
      log.debug("Command field {} rejected: {}", field, ex.getOriginalMessage());
      throw new CommandValidationException(field, "Format", "недопустимое значение");
    } catch (JsonProcessingException ex) {
      throw new PermanentUpstreamException(
          UpstreamFailureKind.MALFORMED_RESPONSE, "Model output is not valid JSON", ex);
    }
  }

  private String unwrap(String rawJson) {
    if (rawJson == null) {
      return null;
    }
    String trimmed = rawJson.trim();
    Matcher matcher = CODE_FENCE.matcher(trimmed);
    return matcher.matches() ? matcher.group(1) : trimmed;
  }

  private String fieldPath(JsonMappingException ex) {
    StringBuilder path = new StringBuilder();
    for (JsonMappingException.Reference reference : ex.getPath()) {
      if (reference.getFieldName() != null) {
        if (path.length() > 0) {
          path.append('.');
        }
        path.append(reference.getFieldName());
      } else if (reference.getIndex() >= 0) {
        path.append('[').append(reference.getIndex()).append(']');
      }
    }
    return path.length() > 0 ? path.toString() : "command";
  }
}
