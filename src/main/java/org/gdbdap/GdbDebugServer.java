package org.gdbdap;

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.gdbdap.debug.*;

/** Routes client requests to the session. The command table is fixed when the server is built. */
public class GdbDebugServer implements DebugServer {
    private static final Gson gson = new Gson();

    private interface Handler {
        List<ProtocolMessage> handle(Request request);
    }

    private final Session session;
    private final Map<String, Handler> commands;

    public GdbDebugServer(Session session) {
        this.session = session;
        this.commands =
                ImmutableMap.<String, Handler>builder()
                        .put("initialize", this::initialize)
                        .put("configurationDone", this::configurationDone)
                        .put("attach", this::attach)
                        .put("launch", this::launch)
                        .put("disconnect", this::disconnect)
                        .put("listProcesses", this::listProcesses)
                        .put("addInferiors", this::addInferiors)
                        .put("detachInferiors", this::detachInferiors)
                        .put("selectInferior", this::selectInferior)
                        .put("continueAfterProcessExit", this::continueAfterProcessExit)
                        .put("threads", this::threads)
                        .put("stackTrace", this::stackTrace)
                        .put("scopes", this::scopes)
                        .put("variables", this::variables)
                        .put("evaluate", this::evaluate)
                        .put("source", this::source)
                        .put("setBreakpoints", this::setBreakpoints)
                        .put("breakpointLocations", this::breakpointLocations)
                        .put("continue", this::resume)
                        .put("pause", this::pause)
                        .put("next", this::next)
                        .put("stepIn", this::stepIn)
                        .put("stepOut", this::stepOut)
                        .build();
    }

    @Override
    public List<ProtocolMessage> handle(Request request) {
        var handler = commands.get(request.command);
        if (handler == null) {
            LOG.warning("Unsupported command " + request.command);
            return List.of(failed(request, "Unsupported command: " + request.command));
        }
        try {
            return handler.handle(request);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
            var message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return List.of(failed(request, message));
        }
    }

    public boolean supports(String command) {
        return commands.containsKey(command);
    }

    private List<ProtocolMessage> initialize(Request req) {
        var args = arguments(req, InitializeRequestArguments.class);
        var client = args.clientName == null ? args.clientID : args.clientName;
        LOG.info(String.format("Initialize %s for %s", args.adapterID, client));
        var caps = new Capabilities();
        caps.supportsConfigurationDoneRequest = true;
        caps.supportsConditionalBreakpoints = true;
        caps.supportsBreakpointLocationsRequest = true;
        caps.supportsEvaluateForHovers = true;
        caps.supportsFunctionBreakpoints = false;
        caps.supportsSetVariable = false;
        caps.supportsCompletionsRequest = false;
        caps.supportsGotoTargetsRequest = false;
        caps.supportsLogPoints = false;
        caps.supportsClipboardContext = false;
        var initialized = new Event();
        initialized.event = "initialized";
        return List.of(ok(req, caps), initialized);
    }

    private List<ProtocolMessage> configurationDone(Request req) {
        return List.of(ok(req, null));
    }

    /** Setup commands from the launch configuration, then the gdbserver connection if one is configured. */
    private CommandResult prepare(SetupCommand[] setupCommands, String gdbServer) {
        for (var c : setupCommands) {
            if (c.text == null || c.text.isBlank()) continue;
            var result = session.gdb.sendChecked(c.text, c.ignoreFailures);
            if (!result.success) return result;
        }
        if (gdbServer != null && !gdbServer.isEmpty()) return session.connectToGdbServer(gdbServer);
        return CommandResult.ok();
    }

    private List<ProtocolMessage> attach(Request req) {
        var args = arguments(req, AttachRequestArguments.class);
        var prepared = prepare(args.setupCommands, args.gdbServer);
        if (!prepared.success) return List.of(failed(req, prepared.message));

        var pid = args.pid;
        if (pid == null && args.program != null) {
            pid = session.inferiors.pidByName(Paths.get(args.program).getFileName().toString()).orElse(null);
        }
        if (pid == null) throw new ProtocolViolationException("The 'pid' field is required in the arguments.");
        var attached = session.inferiors.attach(pid, args.program);
        if (!attached.success) return List.of(failed(req, attached.message));

        session.events.enable();
        var entry = new StoppedEventBody("entry", 1, true, List.of());
        return List.of(ok(req, null), event("stopped", entry));
    }

    private List<ProtocolMessage> launch(Request req) {
        var args = arguments(req, LaunchRequestArguments.class);
        if (args.program == null || args.program.isEmpty()) {
            throw new ProtocolViolationException("The 'program' field is required in the arguments.");
        }
        var prepared = prepare(args.setupCommands, args.gdbServer);
        if (!prepared.success) return List.of(failed(req, prepared.message));

        var loaded = session.execution.loadExecutable(args.program);
        if (!loaded.success) return List.of(failed(req, loaded.message));
        var programArgs = args.args == null ? List.<String>of() : Arrays.asList(args.args);
        session.execution.setProgramArguments(programArgs);
        session.breakpoints.setBreakpointOnMain();
        session.events.enable();
        var started = session.execution.run();
        if (!started.success) return List.of(failed(req, started.message));
        return List.of(ok(req, new LaunchResponseBody()));
    }

    private List<ProtocolMessage> disconnect(Request req) {
        var args = arguments(req, DisconnectArguments.class);
        if (Boolean.TRUE.equals(args.restart)) LOG.warning("Restart is not supported, disconnecting");
        session.stop();
        return List.of(ok(req, null));
    }

    private List<ProtocolMessage> listProcesses(Request req) {
        var listing = session.inferiors.listProcesses();
        if (!listing.result.success) return List.of(failed(req, listing.result.message));
        var body = new ListProcessesResponseBody();
        body.processes = listing.processes;
        body.currentProcess = session.inferiors.currentPid().orElse(null);
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> addInferiors(Request req) {
        var args = arguments(req, InferiorPidsArguments.class);
        var result = session.inferiors.addInferiorsWithPids(args.pids == null ? List.of() : args.pids);
        if (!result.success) return List.of(failed(req, result.message));
        var body = new ListProcessesResponseBody();
        body.processes = processes(session.inferiors.listInferiors());
        body.currentProcess = session.inferiors.currentPid().orElse(null);
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> detachInferiors(Request req) {
        var args = arguments(req, InferiorPidsArguments.class);
        var current = session.inferiors.detachInferiors(args.pids == null ? List.of() : args.pids);
        var body = new DetachInferiorsResponseBody();
        body.processes = processes(session.inferiors.listInferiors());
        body.newCurrentPid = current.orElse(null);

        var messages = new ArrayList<ProtocolMessage>();
        messages.add(ok(req, body));
        if (session.events.isEnabled()) {
            messages.add(event("continued", new ContinuedEventBody(1, true)));
            messages.add(event("stopped", new StoppedEventBody("detach inferior", 1, true, List.of())));
        }
        return messages;
    }

    private static List<ProcessInfo> processes(List<InferiorOrchestrator.Inferior> inferiors) {
        var result = new ArrayList<ProcessInfo>();
        for (var i : inferiors) result.add(new ProcessInfo(i.pid, i.id));
        return result;
    }

    private List<ProtocolMessage> selectInferior(Request req) {
        var args = arguments(req, SelectInferiorArguments.class);
        if (args.pid == null) throw new ProtocolViolationException("The 'pid' field is required in the arguments.");
        if (!session.inferiors.selectInferior(args.pid)) {
            return List.of(failed(req, "Failed to switch to inferior for PID " + args.pid));
        }
        var resp = ok(req, null);
        resp.message = "Switched to inferior";
        return List.of(resp);
    }

    private List<ProtocolMessage> continueAfterProcessExit(Request req) {
        var body = new ContinueAfterProcessExitResponseBody();
        if (!session.inferiors.listInferiors().isEmpty()) {
            body.continueDebugging = true;
            session.inferiors.currentInferior();
            // Refresh gdb and client state
            session.execution.resume(null);
            session.execution.pause(null);
        }
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> threads(Request req) {
        var body = new ThreadsResponseBody();
        body.threads = session.execution.threads();
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> stackTrace(Request req) {
        var args = arguments(req, StackTraceArguments.class);
        if (args.threadId == null) throw new ProtocolViolationException("'threadId' is required for stackTrace request");
        var frames = session.execution.stackTrace(args.threadId);
        var start = args.startFrame == null ? 0 : Math.min(args.startFrame, frames.size());
        var end = frames.size();
        if (args.levels != null && args.levels > 0) end = start + Math.min(args.levels, frames.size() - start);
        var body = new StackTraceResponseBody();
        body.stackFrames = frames.subList(start, end);
        body.totalFrames = frames.size();
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> scopes(Request req) {
        var args = arguments(req, ScopesArguments.class);
        if (args.frameId == null) throw new ProtocolViolationException("The 'frameId' field is required in the arguments.");
        session.execution.selectFrame(args.frameId).check();
        var body = new ScopesResponseBody();
        var scopes = new ArrayList<Scope>();
        if (session.execution.hasLocals()) {
            scopes.add(new Scope("Locals", "locals", VariableReferenceTree.localsHandle(args.frameId)));
        }
        if (session.execution.hasRegisters()) {
            var registers = new Scope("Registers", "registers", VariableReferenceTree.registersHandle(args.frameId));
            registers.expensive = true;
            scopes.add(registers);
        }
        body.scopes = scopes;
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> variables(Request req) {
        var args = arguments(req, VariablesArguments.class);
        if (args.variablesReference == null) {
            throw new ProtocolViolationException("The 'variablesReference' field is required.");
        }
        var body = new VariablesResponseBody();
        body.variables = session.variables.resolve(args.variablesReference);
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> evaluate(Request req) {
        var args = arguments(req, EvaluateArguments.class);
        var body = new EvaluateResponseBody();
        body.result = session.execution.evaluate(args.expression, args.context);
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> source(Request req) {
        var args = arguments(req, SourceArguments.class);
        if (args.source == null || args.source.path == null) {
            throw new ProtocolViolationException("The 'path' field is required in the 'source' object.");
        }
        var path = Paths.get(args.source.path);
        if (!Files.isRegularFile(path)) return List.of(failed(req, "Source file not found: " + args.source.path));
        var body = new SourceResponseBody();
        try {
            body.content = Files.readString(path);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> setBreakpoints(Request req) {
        var args = arguments(req, SetBreakpointsArguments.class);
        if (args.source == null || args.source.path == null) {
            throw new ProtocolViolationException("Invalid arguments: source path is required.");
        }
        var specs = args.breakpoints == null ? List.<SourceBreakpoint>of() : Arrays.asList(args.breakpoints);
        var result = session.breakpoints.setBreakpoints(args.source.path, specs);
        if (!result.success) return List.of(failed(req, result.message));
        var body = new SetBreakpointsResponseBody();
        body.breakpoints = result.breakpoints;
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> breakpointLocations(Request req) {
        var args = arguments(req, BreakpointLocationsArguments.class);
        if (args.source == null || args.source.path == null || args.line == null) {
            throw new ProtocolViolationException("Invalid arguments: source path and line are required.");
        }
        var lines = session.breakpoints.getBreakpointLocations(args.source.path, args.line, args.endLine);
        var locations = new ArrayList<BreakpointLocation>();
        for (var line : lines) locations.add(new BreakpointLocation(line));
        var body = new BreakpointLocationsResponseBody();
        body.breakpoints = locations;
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> resume(Request req) {
        var args = arguments(req, ContinueArguments.class);
        var result = session.execution.resume(args.threadId);
        if (!result.success) return List.of(failed(req, result.message));
        var body = new ContinueResponseBody();
        body.allThreadsContinued = true;
        return List.of(ok(req, body));
    }

    private List<ProtocolMessage> pause(Request req) {
        var args = arguments(req, PauseArguments.class);
        return List.of(respond(req, session.execution.pause(args.threadId)));
    }

    private List<ProtocolMessage> next(Request req) {
        var args = arguments(req, NextArguments.class);
        return List.of(respond(req, session.execution.next(args.threadId)));
    }

    private List<ProtocolMessage> stepIn(Request req) {
        var args = arguments(req, StepInArguments.class);
        return List.of(respond(req, session.execution.stepIn(args.threadId)));
    }

    private List<ProtocolMessage> stepOut(Request req) {
        var args = arguments(req, StepOutArguments.class);
        return List.of(respond(req, session.execution.stepOut(args.threadId, args.singleThread)));
    }

    private static <T> T arguments(Request req, Class<T> type) {
        var json = req.arguments == null ? new JsonObject() : req.arguments;
        return gson.fromJson(json, type);
    }

    private static Response respond(Request req, CommandResult result) {
        return result.success ? ok(req, null) : failed(req, result.message);
    }

    static Response ok(Request req, Object body) {
        var resp = new Response();
        resp.request_seq = req.seq;
        resp.command = req.command;
        resp.success = true;
        if (body != null) resp.body = gson.toJsonTree(body);
        return resp;
    }

    static Response failed(Request req, String message) {
        var resp = new Response();
        resp.request_seq = req.seq;
        resp.command = req.command;
        resp.success = false;
        resp.message = message;
        return resp;
    }

    static Event event(String name, Object body) {
        var evt = new Event();
        evt.event = name;
        evt.body = gson.toJsonTree(body).getAsJsonObject();
        return evt;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
