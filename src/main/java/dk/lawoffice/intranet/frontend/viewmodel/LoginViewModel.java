package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LoginViewModel extends ViewModel {

    private String email;
    private String password;
    private UserDTO user;

    public LoginViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean submit() {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            fail("Please enter both email and password.");
            return false;
        }
        return guard(() -> session.login(email.trim(), password)).map(loggedIn -> {
            user = loggedIn;
            password = null;
            navigator.navigate(Route.DASHBOARD);
            return true;
        }).orElse(false);
    }

    public void logout() {
        session.logout();
        user = null;
        navigator.navigate(Route.LOGIN);
    }
}
