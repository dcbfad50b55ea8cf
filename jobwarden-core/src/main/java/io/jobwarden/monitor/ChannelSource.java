package io.jobwarden.monitor;

import java.util.List;

public interface ChannelSource {

    List<ChannelStatus> findActive();
}
