package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

public class AppointmentsViewModel extends ViewModel {

    @Getter
    private final List<AppointmentDTO> appointments = new ArrayList<>();

    @Getter
    private long totalCount;

    @Getter
    @Setter
    private AppointmentStatus statusFilter;

    @Getter
    @Setter
    private String filter;

    public AppointmentsViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load(int page) {
        return guard(() -> session.call(api -> api.appointments(null, page, null))).map(response -> {
            appointments.clear();
            appointments.addAll(response.getResults());
            totalCount = response.getCount();
            return true;
        }).orElse(false);
    }

    public List<AppointmentDTO> visibleAppointments() {
        return appointments.stream()
                .filter(appointment -> statusFilter == null || appointment.getStatus() == statusFilter)
                .filter(appointment -> matches(filter, appointment.getTitle(), appointment.getClientName(), appointment.getLocation()))
                .collect(Collectors.toList());
    }

    public boolean create(AppointmentDTO appointment) {
        return guard(() -> session.call(api -> api.createAppointment(appointment))).map(created -> {
            appointments.add(0, created);
            totalCount++;
            info("Appointment " + created.getTitle() + " created");
            return true;
        }).orElse(false);
    }

    public boolean confirm(String uuid) {
        return transition(uuid, AppointmentStatus.CONFIRMED, (api, id) -> api.confirmAppointment(id).getStatus());
    }

    public boolean cancel(String uuid) {
        return transition(uuid, AppointmentStatus.CANCELLED, (api, id) -> api.cancelAppointment(id).getStatus());
    }

    public boolean complete(String uuid) {
        return transition(uuid, AppointmentStatus.COMPLETED, (api, id) -> api.completeAppointment(id).getStatus());
    }

    public boolean delete(String uuid) {
        boolean deleted = guardRun(() -> session.run(api -> api.deleteAppointment(uuid)));
        if (deleted && appointments.removeIf(appointment -> Objects.equals(appointment.getUuid(), uuid))) {
            totalCount--;
        }
        return deleted;
    }

    private boolean transition(String uuid, AppointmentStatus target, BiFunction<LawOfficeApi, String, String> action) {
        return guard(() -> session.call(api -> action.apply(api, uuid))).map(message -> {
            appointments.stream()
                    .filter(appointment -> Objects.equals(appointment.getUuid(), uuid))
                    .forEach(appointment -> {
                        appointment.setStatus(target);
                        appointment.setStatusDisplay(target.getLabel());
                    });
            info(message);
            return true;
        }).orElse(false);
    }
}
