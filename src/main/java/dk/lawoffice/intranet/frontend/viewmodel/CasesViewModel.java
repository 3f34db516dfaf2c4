package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.caseservice.dto.CaseDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseNoteDTO;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class CasesViewModel extends ViewModel {

    @Getter
    private final List<CaseDTO> cases = new ArrayList<>();

    @Getter
    private long totalCount;

    @Getter
    @Setter
    private String filter;

    public CasesViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load(int page) {
        return guard(() -> session.call(api -> api.cases(null, page, null))).map(response -> {
            cases.clear();
            cases.addAll(response.getResults());
            totalCount = response.getCount();
            return true;
        }).orElse(false);
    }

    public List<CaseDTO> visibleCases() {
        return cases.stream()
                .filter(legalCase -> matches(filter, legalCase.getTitle(), legalCase.getClientName(), legalCase.getStatusDisplay()))
                .collect(Collectors.toList());
    }

    public boolean create(CaseDTO legalCase) {
        return guard(() -> session.call(api -> api.createCase(legalCase))).map(created -> {
            cases.add(0, created);
            totalCount++;
            return true;
        }).orElse(false);
    }

    public boolean close(String uuid) {
        return guard(() -> session.call(api -> api.closeCase(uuid))).map(closed -> {
            replace(closed);
            info("Case " + closed.getTitle() + " closed");
            return true;
        }).orElse(false);
    }

    public boolean assignToMe(String uuid) {
        return guard(() -> session.call(api -> api.assignCaseToMe(uuid))).map(response -> {
            String me = session.currentUser() != null ? session.currentUser().getUuid() : null;
            cases.stream()
                    .filter(legalCase -> Objects.equals(legalCase.getUuid(), uuid))
                    .filter(legalCase -> me != null && !legalCase.getAssignedTo().contains(me))
                    .forEach(legalCase -> legalCase.getAssignedTo().add(me));
            info(response.getStatus());
            return true;
        }).orElse(false);
    }

    public boolean addNote(String uuid, String content) {
        CaseNoteDTO note = CaseNoteDTO.builder().content(content).build();
        return guard(() -> session.call(api -> api.addCaseNote(uuid, note))).map(created -> {
            cases.stream()
                    .filter(legalCase -> Objects.equals(legalCase.getUuid(), uuid))
                    .forEach(legalCase -> legalCase.getNotes().add(0, created));
            return true;
        }).orElse(false);
    }

    public boolean delete(String uuid) {
        boolean deleted = guardRun(() -> session.run(api -> api.deleteCase(uuid)));
        if (deleted && cases.removeIf(legalCase -> Objects.equals(legalCase.getUuid(), uuid))) {
            totalCount--;
        }
        return deleted;
    }

    private void replace(CaseDTO updated) {
        cases.replaceAll(legalCase -> Objects.equals(legalCase.getUuid(), updated.getUuid()) ? updated : legalCase);
    }
}
