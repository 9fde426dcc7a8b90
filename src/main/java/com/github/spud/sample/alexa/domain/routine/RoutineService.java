package com.github.spud.sample.alexa.domain.routine;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.alexa.domain.command.SequencePayloadFactory;
import com.github.spud.sample.alexa.domain.error.NotFoundException;
import com.github.spud.sample.alexa.domain.error.ProtocolException;
import com.github.spud.sample.alexa.domain.session.AlexaSession;
import com.github.spud.sample.alexa.domain.transport.AlexaTransport;
import com.github.spud.sample.alexa.util.JsonUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * 例程列表与执行
 */
@Slf4j
public class RoutineService {

  private final AlexaTransport transport;

  public RoutineService(AlexaTransport transport) {
    this.transport = transport;
  }

  public List<Routine> getRoutines(AlexaSession session) {
    String body = transport.requestAlexa(session, HttpMethod.GET, "/api/behaviors/automations",
      null);
    JsonNode root = JsonUtils.readBody(body, "routines");
    if (!root.isArray()) {
      throw new ProtocolException("Routines response is not an array");
    }

    List<Routine> routines = new ArrayList<>();
    for (JsonNode node : root) {
      JsonNode sequence = node.path("sequence");
      routines.add(Routine.builder()
        .automationId(node.path("automationId").asText(null))
        .name(node.path("name").asText(null))
        .sequence(sequence.isMissingNode() || sequence.isNull() ? null : sequence.toString())
        .build());
    }
    log.debug("Fetched {} routines", routines.size());
    return routines;
  }

  /**
   * 按名称执行例程。名称须完整匹配（不区分大小写），子串不算命中。
   */
  public Routine execute(AlexaSession session, String routineName) {
    Routine target = findRoutine(getRoutines(session), routineName);

    transport.request(session, HttpMethod.POST, "/api/behaviors/preview",
      SequencePayloadFactory.previewRequest(target.getAutomationId(), target.getSequence()));
    log.info("Executed routine '{}'", target.getName());
    return target;
  }

  static Routine findRoutine(List<Routine> routines, String routineName) {
    String wanted = routineName.toLowerCase(Locale.ROOT);
    for (Routine routine : routines) {
      if (routine.getName() != null && routine.getName().toLowerCase(Locale.ROOT).equals(wanted)) {
        return routine;
      }
    }
    throw new NotFoundException("Routine '" + routineName + "' not found");
  }
}
