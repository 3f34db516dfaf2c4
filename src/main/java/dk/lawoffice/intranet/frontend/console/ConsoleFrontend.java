package dk.lawoffice.intranet.frontend.console;

import dk.lawoffice.intranet.frontend.client.ApiClientFactory;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.FileTokenStore;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import dk.lawoffice.intranet.frontend.client.TokenStore;
import dk.lawoffice.intranet.frontend.format.DisplayFormat;
import dk.lawoffice.intranet.frontend.viewmodel.AppointmentsViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.BillingViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.CasesViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.ClientsViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.DashboardViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.LoginViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.Navigator;
import dk.lawoffice.intranet.frontend.viewmodel.ProfileViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.Route;
import dk.lawoffice.intranet.frontend.viewmodel.ViewModel;
import lombok.extern.jbosslog.JBossLog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Line-oriented terminal front-end. Tokens are kept in a file so a login survives restarts.
 *
 * <pre>
 * java -cp ... dk.lawoffice.intranet.frontend.console.ConsoleFrontend [api-base-url] [token-file]
 * </pre>
 */
@JBossLog
public class ConsoleFrontend implements Navigator {

    static final String PROMPT = "lawoffice> ";
    static final String HELP = String.join(System.lineSeparator(),
            "login <email> <password>       log in",
            "logout                         log out",
            "dashboard                      overview",
            "clients [text]                 list clients",
            "appointments [text]            list appointments",
            "confirm|cancel|complete <id>   change an appointment status",
            "cases [text]                   list cases",
            "close <id>                     close a case",
            "billing [text]                 list invoices",
            "pay <id> | send <id>           mark an invoice paid or send it",
            "profile                        show your profile",
            "help | quit");

    private final ApiSession session;
    private final TextRenderer renderer;
    private final PrintStream out;

    private final AppointmentsViewModel appointments;
    private final CasesViewModel cases;
    private final BillingViewModel billing;

    private Route route;

    public ConsoleFrontend(ApiSession session, PrintStream out) {
        this.session = session;
        this.out = out;
        this.renderer = new TextRenderer();
        this.appointments = new AppointmentsViewModel(session, this);
        this.cases = new CasesViewModel(session, this);
        this.billing = new BillingViewModel(session, this);
        this.route = session.isAuthenticated() ? Route.DASHBOARD : Route.LOGIN;
    }

    public static void main(String[] args) throws Exception {
        String baseUrl = args.length > 0 ? args[0] : "http://localhost:9093";
        Path tokenFile = args.length > 1 ? Path.of(args[1]) : Path.of(System.getProperty("user.home"), ".lawoffice", "tokens.json");
        ApiClientFactory factory = new ApiClientFactory(baseUrl, Duration.ofSeconds(30));
        TokenStore tokenStore = new FileTokenStore(tokenFile, factory.getObjectMapper());
        try (LawOfficeApi api = factory.create(tokenStore)) {
            ConsoleFrontend console = new ConsoleFrontend(new ApiSession(api, tokenStore, factory.getTimeout()), System.out);
            console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
        log.debug("Console front-end stopped");
    }

    public void run(BufferedReader in) throws IOException {
        out.println(session.isAuthenticated() ? "Welcome back. Type 'help' for commands." : "Please log in. Type 'help' for commands.");
        String line;
        out.print(PROMPT);
        while ((line = in.readLine()) != null) {
            if (!execute(line)) break;
            out.print(PROMPT);
        }
    }

    /**
     * Runs one command line. Returns {@code false} when the user asked to quit.
     */
    public boolean execute(String line) {
        String[] words = line.trim().split("\\s+", 3);
        String command = words[0].toLowerCase();
        String argument = words.length > 1 ? line.trim().substring(words[0].length()).trim() : null;
        if (command.isEmpty()) return true;
        switch (command) {
            case "quit", "exit" -> {
                return false;
            }
            case "help" -> out.println(HELP);
            case "login" -> login(words);
            case "logout" -> {
                new LoginViewModel(session, this).logout();
                out.println("Logged out.");
            }
            default -> {
                if (!session.isAuthenticated()) {
                    out.println("Please log in first.");
                } else {
                    dispatch(command, argument);
                }
            }
        }
        return true;
    }

    private void dispatch(String command, String argument) {
        switch (command) {
            case "dashboard" -> {
                DashboardViewModel model = new DashboardViewModel(session, this);
                if (model.load()) out.print(renderer.dashboard(model.getDashboard()));
                report(model);
            }
            case "clients" -> {
                ClientsViewModel model = new ClientsViewModel(session, this);
                model.setFilter(argument);
                if (model.load(1)) out.print(renderer.clients(model.visibleClients()));
                report(model);
            }
            case "appointments" -> {
                appointments.setFilter(argument);
                if (appointments.load(1)) out.print(renderer.appointments(appointments.visibleAppointments()));
                report(appointments);
            }
            case "confirm", "cancel", "complete" -> {
                Optional<String> uuid = resolve(argument, appointments.getAppointments(), a -> a.getUuid());
                if (uuid.isEmpty()) {
                    out.println("Unknown appointment; run 'appointments' first.");
                    return;
                }
                switch (command) {
                    case "confirm" -> appointments.confirm(uuid.get());
                    case "cancel" -> appointments.cancel(uuid.get());
                    default -> appointments.complete(uuid.get());
                }
                report(appointments);
            }
            case "cases" -> {
                cases.setFilter(argument);
                if (cases.load(1)) out.print(renderer.cases(cases.visibleCases()));
                report(cases);
            }
            case "close" -> {
                Optional<String> uuid = resolve(argument, cases.getCases(), c -> c.getUuid());
                if (uuid.isEmpty()) {
                    out.println("Unknown case; run 'cases' first.");
                    return;
                }
                cases.close(uuid.get());
                report(cases);
            }
            case "billing" -> {
                billing.setFilter(argument);
                if (billing.load(1)) {
                    out.print(renderer.invoices(billing.visibleInvoices()));
                    out.println("Outstanding: " + DisplayFormat.currency(billing.outstanding()));
                }
                report(billing);
            }
            case "pay", "send" -> {
                Optional<String> uuid = resolve(argument, billing.getInvoices(), i -> i.getUuid());
                if (uuid.isEmpty()) {
                    out.println("Unknown invoice; run 'billing' first.");
                    return;
                }
                if (command.equals("pay")) billing.markAsPaid(uuid.get());
                else billing.sendToClient(uuid.get());
                report(billing);
            }
            case "profile" -> {
                ProfileViewModel model = new ProfileViewModel(session, this);
                if (model.load()) out.print(renderer.profile(model.getProfile()));
                report(model);
            }
            default -> out.println("Unknown command '" + command + "'. Type 'help' for commands.");
        }
    }

    private void login(String[] words) {
        if (words.length < 3) {
            out.println("Usage: login <email> <password>");
            return;
        }
        LoginViewModel model = new LoginViewModel(session, this);
        model.setEmail(words[1]);
        model.setPassword(words[2]);
        if (model.submit()) {
            out.println("Logged in as " + model.getUser().getFullName() + ".");
        }
        report(model);
    }

    private void report(ViewModel model) {
        if (model.getInfoMessage() != null) out.println(model.getInfoMessage());
        if (model.getErrorMessage() != null) out.println("Error: " + model.getErrorMessage());
    }

    /**
     * Finds the single loaded item whose id starts with {@code prefix}.
     */
    static <T> Optional<String> resolve(String prefix, List<T> items, Function<T, String> id) {
        if (prefix == null || prefix.isBlank()) return Optional.empty();
        List<String> matches = items.stream().map(id).filter(uuid -> uuid != null && uuid.startsWith(prefix.trim())).collect(Collectors.toList());
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    @Override
    public void navigate(Route route) {
        if (route == Route.LOGIN && this.route != Route.LOGIN) {
            out.println("Your session has ended. Please log in again.");
        }
        this.route = route;
    }

    Route getRoute() {
        return route;
    }
}
