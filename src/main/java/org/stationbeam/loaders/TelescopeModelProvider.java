package org.stationbeam.loaders;

import org.stationbeam.data.TelescopeModel;

public interface TelescopeModelProvider {
    TelescopeModel getTelescopeModel(String telescope, String beamModel);
}
