package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import dk.lawoffice.intranet.userservice.dto.ChangePasswordRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.dto.UserUpdateRequest;
import lombok.Getter;

@Getter
public class ProfileViewModel extends ViewModel {

    private UserDTO profile;

    public ProfileViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load() {
        return guard(() -> session.call(LawOfficeApi::profile)).map(loaded -> {
            profile = loaded;
            return true;
        }).orElse(false);
    }

    public boolean save(UserUpdateRequest changes) {
        return guard(() -> session.call(api -> api.updateProfile(changes))).map(updated -> {
            profile = updated;
            info("Profile updated");
            return true;
        }).orElse(false);
    }

    public boolean changePassword(String oldPassword, String newPassword, String confirmation) {
        if (newPassword == null || !newPassword.equals(confirmation)) {
            fail("New passwords do not match.");
            return false;
        }
        return guard(() -> session.call(api -> api.changePassword(new ChangePasswordRequest(oldPassword, newPassword)))).map(response -> {
            info(response.getMessage());
            return true;
        }).orElse(false);
    }
}
