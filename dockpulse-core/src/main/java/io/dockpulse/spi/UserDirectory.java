package io.dockpulse.spi;

import java.util.List;

public interface UserDirectory {
    List<String> findAllUserIds();
}
