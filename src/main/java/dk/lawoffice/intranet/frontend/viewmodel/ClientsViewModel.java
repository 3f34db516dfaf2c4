package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One page of clients plus a local text filter. Writes update the loaded page in place once
 * the server has accepted them.
 */
public class ClientsViewModel extends ViewModel {

    @Getter
    private final List<ClientDTO> clients = new ArrayList<>();

    @Getter
    private long totalCount;

    @Getter
    private int page = 1;

    @Getter
    @Setter
    private String filter;

    public ClientsViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load(int page) {
        return guard(() -> session.call(api -> api.clients(null, null, page, null))).map(response -> {
            replaceAll(response);
            this.page = page;
            return true;
        }).orElse(false);
    }

    public List<ClientDTO> visibleClients() {
        return clients.stream()
                .filter(client -> matches(filter, client.getFirstName(), client.getLastName(), client.getEmail(), client.getPhone()))
                .collect(Collectors.toList());
    }

    public boolean create(ClientDTO client) {
        return guard(() -> session.call(api -> api.createClient(client))).map(created -> {
            clients.add(0, created);
            totalCount++;
            info("Client " + created.getFullName() + " created");
            return true;
        }).orElse(false);
    }

    public boolean update(ClientDTO client) {
        return guard(() -> session.call(api -> api.updateClient(client.getUuid(), client))).map(updated -> {
            replace(updated);
            return true;
        }).orElse(false);
    }

    public boolean setActive(String uuid, boolean active) {
        return guard(() -> session.call(api -> active ? api.activateClient(uuid) : api.deactivateClient(uuid))).map(updated -> {
            replace(updated);
            return true;
        }).orElse(false);
    }

    public boolean delete(String uuid) {
        boolean deleted = guardRun(() -> session.run(api -> api.deleteClient(uuid)));
        if (deleted && clients.removeIf(client -> Objects.equals(client.getUuid(), uuid))) {
            totalCount--;
        }
        return deleted;
    }

    private void replaceAll(PagedResponse<ClientDTO> response) {
        clients.clear();
        clients.addAll(response.getResults());
        totalCount = response.getCount();
    }

    private void replace(ClientDTO updated) {
        clients.replaceAll(client -> Objects.equals(client.getUuid(), updated.getUuid()) ? updated : client);
    }
}
