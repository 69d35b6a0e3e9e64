package com.herzen.completion.source;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface CompletionSource {

    // null blockIds returns every block of the course
    Map<String, Double> getLeafValues(String userId, String courseId, Collection<String> blockIds);

    List<String> usersWithCompletions(String courseId);
}
