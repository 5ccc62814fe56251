package com.threatintel.auth.directory;

import java.util.List;

public record SubsourceGroup(String id, List<String> subsourceIds) {

    public SubsourceGroup {
        subsourceIds = List.copyOf(subsourceIds);
    }
}
