package com.yourapp.chatshell.config;

import com.yourapp.chatshell.shell.ConsolePrinter;
import com.yourapp.chatshell.shell.ShellTheme;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ShellConfig {

  @Bean
  public ShellTheme shellTheme(@Value("${app.ui.colors-enabled:true}") boolean colorsEnabled) {
    return ShellTheme.of(colorsEnabled && System.getenv("NO_COLOR") == null);
  }

  @Bean
  public ConsolePrinter consolePrinter(
      ShellTheme theme,
      Clock clock,
      @Value("${app.ui.show-timestamps:true}") boolean showTimestamps,
      @Value("${app.ui.width:80}") int width) {
    return new ConsolePrinter(System.out, theme, showTimestamps, width, clock);
  }
}
