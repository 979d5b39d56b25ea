package com.whereq.dispatch.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.support.InMemoryJobStore.FakeJob;
import com.whereq.dispatch.transport.SearchTransport;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchTransport} that serves the jobs collection from an {@link InMemoryJobStore}
 * and behaves like the search head for control actions.
 */
public class FakeSearchTransport implements SearchTransport {

    private static final String JOBS = "/search/v2/jobs";

    private final InMemoryJobStore store;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> calls = new ArrayList<>();

    public FakeSearchTransport(InMemoryJobStore store) {
        this.store = store;
    }

    /**
     * Calls seen so far, formatted as "METHOD path"
     */
    public synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }

    @Override
    public synchronized JsonNode get(String path, Map<String, ?> params, Duration timeout) {
        calls.add("GET " + path);
        if (path.equals(JOBS)) {
            return listing(params);
        }
        if (path.endsWith("/summary")) {
            requireJob(sidOf(path.substring(0, path.length() - "/summary".length())));
            return objectMapper.createObjectNode().set("fields", objectMapper.createObjectNode());
        }
        FakeJob job = requireJob(sidOf(path));
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode entry = root.putArray("entry").addObject();
        entry.put("name", job.getSid());
        entry.set("content", content(job));
        return root;
    }

    @Override
    public synchronized JsonNode post(String path, Map<String, ?> data, Duration timeout) {
        calls.add("POST " + path + " " + data.get("action"));
        if (!path.endsWith("/control")) {
            throw new IllegalArgumentException("Unexpected POST " + path);
        }
        FakeJob job = requireJob(sidOf(path.substring(0, path.length() - "/control".length())));
        String action = String.valueOf(data.get("action"));
        boolean terminal = job.getState().isTerminal();
        switch (action) {
            case "cancel":
                job.setState(JobState.DONE);
                job.setDone(true);
                break;
            case "pause":
                if (!terminal) {
                    job.setState(JobState.PAUSED);
                    job.setPaused(true);
                }
                break;
            case "unpause":
                if (job.isPaused()) {
                    job.setState(JobState.RUNNING);
                    job.setPaused(false);
                }
                break;
            case "finalize":
                if (!terminal) {
                    job.setState(JobState.FINALIZING);
                }
                break;
            case "setttl":
                job.setTtl(Long.parseLong(String.valueOf(data.get("ttl"))));
                break;
            case "touch":
                job.setTouches(job.getTouches() + 1);
                break;
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
        return objectMapper.createObjectNode();
    }

    @Override
    public synchronized JsonNode delete(String path, Duration timeout) {
        calls.add("DELETE " + path);
        String sid = sidOf(path);
        if (store.remove(sid) == null) {
            throw notFound(sid);
        }
        return objectMapper.createObjectNode();
    }

    private JsonNode listing(Map<String, ?> params) {
        int count = Integer.parseInt(String.valueOf(params.get("count")));
        int offset = Integer.parseInt(String.valueOf(params.get("offset")));
        List<FakeJob> all = store.all();
        int end = count == 0 ? all.size() : Math.min(all.size(), offset + count);

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode entries = root.putArray("entry");
        for (int i = offset; i < end; i++) {
            FakeJob job = all.get(i);
            ObjectNode entry = entries.addObject();
            entry.put("name", job.getSid());
            entry.set("content", content(job));
        }
        ObjectNode paging = root.putObject("paging");
        paging.put("total", all.size());
        paging.put("perPage", count);
        paging.put("offset", offset);
        return root;
    }

    private ObjectNode content(FakeJob job) {
        ObjectNode content = objectMapper.createObjectNode();
        content.put("sid", job.getSid());
        content.put("dispatchState", job.getState().name());
        content.put("doneProgress", job.getDoneProgress());
        content.put("eventCount", job.getEventCount());
        content.put("resultCount", job.getResultCount());
        content.put("ttl", job.getTtl());
        content.put("isDone", job.isDone());
        content.put("isFailed", job.isFailed());
        content.put("isPaused", job.isPaused());
        ArrayNode messages = content.putArray("messages");
        for (String[] message : job.getMessages()) {
            messages.addObject().put("type", message[0]).put("text", message[1]);
        }
        return content;
    }

    private FakeJob requireJob(String sid) {
        FakeJob job = store.get(sid);
        if (job == null) {
            throw notFound(sid);
        }
        return job;
    }

    private static NotFoundException notFound(String sid) {
        return new NotFoundException("HTTP 404: Unknown sid " + sid, "job " + sid, null);
    }

    private static String sidOf(String jobPath) {
        String encoded = jobPath.substring(JOBS.length() + 1);
        return UriUtils.decode(encoded, StandardCharsets.UTF_8);
    }
}
