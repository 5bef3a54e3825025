package io.linchmind.daemon.infra;

import io.linchmind.daemon.config.ConnectorDaemonProperties;
import io.linchmind.process.FileProcessLogSink;
import io.linchmind.process.LocalProcessSupervisor;
import io.linchmind.process.ProcessSupervisor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProcessSupervisorConfiguration {

    @Bean
    public ProcessSupervisor processSupervisor(ConnectorDaemonProperties properties) {
        ConnectorDaemonProperties.Process process = properties.getProcess();
        return new LocalProcessSupervisor(new FileProcessLogSink(process.getLogDir()), process.getKillTimeout());
    }
}
