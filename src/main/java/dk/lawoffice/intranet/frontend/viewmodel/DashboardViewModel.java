package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.dashboardservice.dto.DashboardDTO;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import lombok.Getter;

@Getter
public class DashboardViewModel extends ViewModel {

    private DashboardDTO dashboard;

    public DashboardViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load() {
        return guard(() -> session.call(LawOfficeApi::dashboard)).map(loaded -> {
            dashboard = loaded;
            return true;
        }).orElse(false);
    }
}
