package com.ddm.metis.resolver;

import com.ddm.metis.mapper.AnnotatedAppConfig;
import com.ddm.metis.mapper.AppConfig;
import com.ddm.metis.result.ConfigError;

import java.util.List;

/**
 * 一次成功解析的完整结果，由 {@link ConfigResolver} 持有。
 *
 * @param config    最终配置
 * @param annotated 附带来源信息的配置
 * @param warnings  容忍的远端读取告警
 * @author liyifei
 */
public record Resolution(AppConfig config, AnnotatedAppConfig annotated, List<ConfigError> warnings) {

    public Resolution {
        warnings = List.copyOf(warnings);
    }
}
