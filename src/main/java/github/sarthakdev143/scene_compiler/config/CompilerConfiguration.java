package github.sarthakdev143.scene_compiler.config;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public ColorTable colorTable() {
        return ColorTable.defaults();
    }
}
