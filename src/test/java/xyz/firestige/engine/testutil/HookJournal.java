package xyz.firestige.engine.testutil;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 按调用顺序记录 "serviceId:hook"
 */
public class HookJournal {

    private final List<String> entries = new CopyOnWriteArrayList<>();

    public void record(String serviceId, String hook) {
        entries.add(serviceId + ":" + hook);
    }

    public List<String> entries() {
        return List.copyOf(entries);
    }

    public List<String> callsOf(String serviceId) {
        String prefix = serviceId + ":";
        return entries.stream()
                .filter(e -> e.startsWith(prefix))
                .map(e -> e.substring(prefix.length()))
                .collect(Collectors.toList());
    }

    public long count(String hook) {
        return entries.stream().filter(e -> e.endsWith(":" + hook)).count();
    }
}
