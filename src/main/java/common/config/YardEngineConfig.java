package common.config;

import engine.YardResolutionEngine;
import lombok.extern.slf4j.Slf4j;
import model.bo.TopologySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 在 Spring 容器启动时把 YardTopologyProperties 转换为不可变配置，
 * 并据此构建解析引擎；引擎本身不依赖 Spring。
 */
@Configuration
@Slf4j
public class YardEngineConfig {

    @Bean
    public TopologySettings topologySettings(YardTopologyProperties properties) {
        TopologySettings settings = properties.toSettings();
        log.info("堆场拓扑配置加载完成: 特殊堆栈={}, 号段={}, 箱型覆盖={}",
                settings.getSpecialStacks(), settings.getBands(), settings.getSizeOverrides());
        return settings;
    }

    @Bean
    public YardResolutionEngine yardResolutionEngine(TopologySettings topologySettings) {
        return new YardResolutionEngine(topologySettings);
    }
}
