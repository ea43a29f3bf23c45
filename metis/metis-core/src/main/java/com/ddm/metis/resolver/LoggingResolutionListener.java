package com.ddm.metis.resolver;

import com.ddm.metis.defined.ResolutionStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将阶段事件以 JSON 形式写入日志。失败阶段为 ERROR，完成为 INFO，其余为 DEBUG。
 *
 * @author liyifei
 */
public final class LoggingResolutionListener implements ResolutionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingResolutionListener.class);

    private final ObjectMapper mapper;

    public LoggingResolutionListener() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING));
    }

    public LoggingResolutionListener(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void onStage(StageEvent event) {
        String json = render(event);
        if (!event.success()) {
            log.error("Config resolution stage failed: {}", json);
        } else if (event.stage() == ResolutionStage.DONE) {
            log.info("Config resolution completed: {}", json);
        } else {
            log.debug("Config resolution stage: {}", json);
        }
    }

    String render(StageEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to render stage event {}", event.stage(), e);
            return String.valueOf(event);
        }
    }
}
