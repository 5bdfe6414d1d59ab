package com.supalosa.ants.colony;

public class NoOpColonyObserver implements ColonyObserver {

    @Override
    public void initialise(AntColony colony) {

    }

    @Override
    public void onStep(AntColony colony) {

    }

    @Override
    public void stop(AntColony colony) {

    }
}
