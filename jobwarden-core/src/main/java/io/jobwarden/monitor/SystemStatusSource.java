package io.jobwarden.monitor;

public interface SystemStatusSource {

    SystemStatus current();
}
