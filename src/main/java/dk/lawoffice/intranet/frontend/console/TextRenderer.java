package dk.lawoffice.intranet.frontend.console;

import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardDTO;
import dk.lawoffice.intranet.frontend.format.DisplayFormat;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.userservice.dto.UserDTO;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Plain-text tables for the console front-end.
 */
public class TextRenderer {

    static final String EMPTY = "(nothing to show)";

    public String dashboard(DashboardDTO dashboard) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("Clients: %d   Appointments: %d   Upcoming: %d   Completed: %d   New this month: %d%n",
                dashboard.getTotalClients(), dashboard.getTotalAppointments(), dashboard.getUpcomingAppointments(),
                dashboard.getCompletedAppointments(), dashboard.getNewClientsThisMonth()));
        out.append(System.lineSeparator()).append("Upcoming appointments").append(System.lineSeparator());
        out.append(appointments(dashboard.getUpcomingAppointmentsList()));
        return out.toString();
    }

    public String clients(List<ClientDTO> clients) {
        List<String[]> rows = new ArrayList<>();
        for (ClientDTO client : clients) {
            rows.add(new String[]{shortId(client.getUuid()), client.getFullName(), client.getEmail(), client.getCity(),
                    Boolean.FALSE.equals(client.getActive()) ? "inactive" : "active"});
        }
        return table(new String[]{"ID", "NAME", "EMAIL", "CITY", "STATE"}, rows);
    }

    public String appointments(List<AppointmentDTO> appointments) {
        List<String[]> rows = new ArrayList<>();
        for (AppointmentDTO appointment : appointments) {
            rows.add(new String[]{shortId(appointment.getUuid()), appointment.getTitle(), appointment.getClientName(),
                    DisplayFormat.timeRange(appointment.getStartTime(), appointment.getEndTime()), appointment.getStatusDisplay()});
        }
        return table(new String[]{"ID", "TITLE", "CLIENT", "WHEN", "STATUS"}, rows);
    }

    public String cases(List<CaseDTO> cases) {
        List<String[]> rows = new ArrayList<>();
        for (CaseDTO legalCase : cases) {
            rows.add(new String[]{shortId(legalCase.getUuid()), legalCase.getTitle(), legalCase.getClientName(),
                    String.join(", ", legalCase.getAssignedToNames()), legalCase.getStatusDisplay()});
        }
        return table(new String[]{"ID", "TITLE", "CLIENT", "ASSIGNED", "STATUS"}, rows);
    }

    public String invoices(List<InvoiceDTO> invoices) {
        List<String[]> rows = new ArrayList<>();
        for (InvoiceDTO invoice : invoices) {
            rows.add(new String[]{shortId(invoice.getUuid()), invoice.getInvoiceNumber(), invoice.getClientName(),
                    DisplayFormat.date(invoice.getDueDate()), DisplayFormat.currency(invoice.getTotal()), invoice.getStatusDisplay()});
        }
        return table(new String[]{"ID", "NUMBER", "CLIENT", "DUE", "TOTAL", "STATUS"}, rows);
    }

    public String profile(UserDTO user) {
        return table(new String[]{"FIELD", "VALUE"}, List.of(
                new String[]{"Name", user.getFullName()},
                new String[]{"Email", user.getEmail()},
                new String[]{"Role", user.getUserTypeDisplay()},
                new String[]{"Phone", user.getPhone()},
                new String[]{"Joined", DisplayFormat.dateTime(user.getDateJoined())}));
    }

    /**
     * Left-aligned columns sized to their widest cell. Null cells print as blanks.
     */
    public String table(String[] headers, List<String[]> rows) {
        if (rows.isEmpty()) return EMPTY + System.lineSeparator();
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) widths[i] = headers[i].length();
        for (String[] row : rows) {
            for (int i = 0; i < headers.length; i++) widths[i] = Math.max(widths[i], cell(row, i).length());
        }
        StringBuilder out = new StringBuilder();
        appendRow(out, headers, widths);
        String[] rule = new String[headers.length];
        for (int i = 0; i < headers.length; i++) rule[i] = "-".repeat(widths[i]);
        appendRow(out, rule, widths);
        for (String[] row : rows) appendRow(out, row, widths);
        return out.toString();
    }

    private static void appendRow(StringBuilder out, String[] row, int[] widths) {
        String[] padded = new String[widths.length];
        for (int i = 0; i < widths.length; i++) {
            padded[i] = String.format("%-" + widths[i] + "s", cell(row, i));
        }
        out.append(String.join("  ", Arrays.asList(padded)).stripTrailing()).append(System.lineSeparator());
    }

    private static String cell(String[] row, int index) {
        return index < row.length && row[index] != null ? row[index] : "";
    }

    static String shortId(String uuid) {
        return uuid != null && uuid.length() > 8 ? uuid.substring(0, 8) : uuid;
    }
}
