package com.github.spud.sample.alexa.interfaces.rest;

import com.github.spud.sample.alexa.domain.client.AlexaClient;
import com.github.spud.sample.alexa.domain.client.AlexaClientFactory;
import com.github.spud.sample.alexa.domain.conversation.Conversation;
import com.github.spud.sample.alexa.domain.conversation.FragmentPage;
import com.github.spud.sample.alexa.domain.device.Device;
import com.github.spud.sample.alexa.domain.device.SmartHomeAction;
import com.github.spud.sample.alexa.domain.device.SmartHomeDevice;
import com.github.spud.sample.alexa.domain.history.HistoryRecord;
import com.github.spud.sample.alexa.domain.routine.Routine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Alexa 控制 API
 * <p>
 * 客户端是阻塞的，统一在 boundedElastic 上执行；每个请求使用独立会话。
 */
@Slf4j
@RestController
@RequestMapping("/alexa")
@RequiredArgsConstructor
public class AlexaController {

  private final AlexaClientFactory clientFactory;

  @GetMapping("/devices")
  public Mono<ResponseEntity<List<Device>>> devices() {
    return call(AlexaClient::getDevices);
  }

  /**
   * 在指定设备上朗读文本
   */
  @PostMapping("/speak")
  public Mono<ResponseEntity<CommandResponse>> speak(@Valid @RequestBody SpeakRequest request) {
    return call(client -> {
      log.info("Speak on device={}, length={}", request.getDevice(), request.getText().length());
      client.speak(request.getDevice(), request.getText());
      return new CommandResponse(true, "Spoke on " + request.getDevice());
    });
  }

  /**
   * 向所有设备广播
   */
  @PostMapping("/announce")
  public Mono<ResponseEntity<CommandResponse>> announce(
    @Valid @RequestBody AnnounceRequest request) {
    return call(client -> {
      client.announce(request.getText());
      return new CommandResponse(true, "Announced");
    });
  }

  /**
   * 文本指令，效果等同对设备说话
   */
  @PostMapping("/command")
  public Mono<ResponseEntity<CommandResponse>> command(@Valid @RequestBody SpeakRequest request) {
    return call(client -> {
      client.textCommand(request.getDevice(), request.getText());
      return new CommandResponse(true, "Command sent to " + request.getDevice());
    });
  }

  @GetMapping("/routines")
  public Mono<ResponseEntity<List<Routine>>> routines() {
    return call(AlexaClient::getRoutines);
  }

  @PostMapping("/routines/run")
  public Mono<ResponseEntity<CommandResponse>> runRoutine(
    @Valid @RequestBody RoutineRequest request) {
    return call(client -> {
      client.runRoutine(request.getName());
      return new CommandResponse(true, "Routine '" + request.getName() + "' started");
    });
  }

  /**
   * 最近若干小时的语音历史
   */
  @GetMapping("/history")
  public Mono<ResponseEntity<List<HistoryRecord>>> history(
    @RequestParam(defaultValue = "24") int hours) {
    if (hours <= 0) {
      return Mono.error(new IllegalArgumentException("hours must be positive"));
    }
    return call(client -> {
      Instant end = Instant.now();
      return client.getHistory(end.minus(Duration.ofHours(hours)), end);
    });
  }

  /**
   * 经设备发问并从语音历史中取回答
   */
  @PostMapping("/ask")
  public Mono<ResponseEntity<AskResponse>> ask(@Valid @RequestBody AskRequest request) {
    return call(client -> {
      String answer = request.getTimeoutSeconds() != null
        ? client.ask(request.getDevice(), request.getQuestion(),
        Duration.ofSeconds(request.getTimeoutSeconds()))
        : client.ask(request.getDevice(), request.getQuestion());
      return new AskResponse(request.getQuestion(), answer, "alexa");
    });
  }

  /**
   * 经 Alexa+ 发问。可指定设备（取其最近会话）或会话 ID。
   */
  @PostMapping("/ask-plus")
  public Mono<ResponseEntity<AskResponse>> askPlus(@Valid @RequestBody AskPlusRequest request) {
    return call(client -> {
      if (StringUtils.hasText(request.getConversationId())) {
        client.setConversationId(request.getConversationId());
      } else if (StringUtils.hasText(request.getDevice())) {
        client.useConversationOf(request.getDevice());
      }
      String answer = request.getTimeoutSeconds() != null
        ? client.askPlus(request.getQuestion(), Duration.ofSeconds(request.getTimeoutSeconds()))
        : client.askPlus(request.getQuestion());
      return new AskResponse(request.getQuestion(), answer, "alexa_plus");
    });
  }

  @GetMapping("/conversations")
  public Mono<ResponseEntity<List<Conversation>>> conversations() {
    return call(AlexaClient::getConversations);
  }

  @GetMapping("/conversations/{conversationId}/fragments")
  public Mono<ResponseEntity<FragmentPage>> fragments(@PathVariable String conversationId) {
    return call(client -> {
      client.setConversationId(conversationId);
      return client.getFragments();
    });
  }

  @GetMapping("/smarthome")
  public Mono<ResponseEntity<List<SmartHomeDevice>>> smartHome() {
    return call(AlexaClient::getSmartHomeDevices);
  }

  @PostMapping("/smarthome/control")
  public Mono<ResponseEntity<CommandResponse>> controlSmartHome(
    @Valid @RequestBody SmartHomeRequest request) {
    return call(client -> {
      SmartHomeDevice device = client.controlSmartHome(request.getDevice(), request.getAction(),
        request.getBrightness());
      return new CommandResponse(true, request.getAction() + " sent to " + device.getName());
    });
  }

  private <T> Mono<ResponseEntity<T>> call(Function<AlexaClient, T> action) {
    Callable<ResponseEntity<T>> callable = () -> ResponseEntity.ok(
      action.apply(clientFactory.connect()));
    return Mono.fromCallable(callable)
      .subscribeOn(Schedulers.boundedElastic());
  }

  // ===== DTOs =====

  @Data
  public static class SpeakRequest {

    @NotBlank
    private String device;
    @NotBlank
    private String text;
  }

  @Data
  public static class AnnounceRequest {

    @NotBlank
    private String text;
  }

  @Data
  public static class RoutineRequest {

    @NotBlank
    private String name;
  }

  @Data
  public static class AskRequest {

    @NotBlank
    private String device;
    @NotBlank
    private String question;
    @Positive
    private Integer timeoutSeconds;
  }

  @Data
  public static class AskPlusRequest {

    @NotBlank
    private String question;
    private String device;
    private String conversationId;
    @Positive
    private Integer timeoutSeconds;
  }

  @Data
  public static class SmartHomeRequest {

    @NotBlank
    private String device;
    @NotNull
    private SmartHomeAction action;
    @Min(0)
    @Max(100)
    private Integer brightness;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CommandResponse {

    private boolean success;
    private String message;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class AskResponse {

    private String question;
    private String response;
    private String type;
  }
}
